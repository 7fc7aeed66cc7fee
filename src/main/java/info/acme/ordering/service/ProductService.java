package info.acme.ordering.service;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;

import info.acme.ordering.domain.Product;

public interface ProductService {
    /**
     * Finds a product by its id.
     *
     * @param productId The id of the product.
     * @return The found product.
     * @throws ProductNotFoundException if no product exists with the given id.
     */
    Product getProduct(Long productId);

    /**
     * Sets the available quantity of a product.
     *
     * @param productId The id of the product.
     * @param quantity  The new available quantity, not negative.
     * @return The updated product.
     * @throws InvalidInputException    if the quantity is negative.
     * @throws ProductNotFoundException if no product was updated.
     */
    Product setAvailability(Long productId, int quantity);

    /**
     * Sets the unit price of a product.
     *
     * @param productId The id of the product.
     * @param price     The new price, positive with at most two decimal digits.
     * @return The updated product.
     * @throws InvalidInputException    if the price is not positive or has more
     *                                  than two decimal digits.
     * @throws ProductNotFoundException if no product was updated.
     */
    Product setPrice(Long productId, BigDecimal price);

    /**
     * Finds all products whose id is in {@code productIds}. Unknown ids are
     * silently skipped; callers compare sizes to detect them.
     *
     * @param productIds The ids to look up.
     * @return The matching products.
     */
    List<Product> findByIds(Collection<Long> productIds);

    /**
     * Searches keywords, name and description for any of the given terms.
     *
     * @param termExpression Terms separated by {@code |}.
     * @return The matching products, possibly empty.
     * @throws InvalidInputException if the expression contains no terms.
     */
    List<Product> searchProducts(String termExpression);
}
