package info.acme.ordering.repository;

import java.math.BigDecimal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import info.acme.ordering.domain.Product;

/**
 * Repository interface for managing {@link Product} entities.
 * Updates are issued as single statements so that the affected row count tells
 * whether the product exists.
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, Long> {
    /**
     * Sets the available quantity of a product.
     *
     * @param productId The product to update.
     * @param available The new available quantity.
     * @return The number of rows updated, 0 if the product does not exist.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Product p set p.available = :available where p.id = :productId")
    int updateAvailable(@Param("productId") Long productId, @Param("available") int available);

    /**
     * Sets the unit price of a product.
     *
     * @param productId The product to update.
     * @param price     The new price.
     * @return The number of rows updated, 0 if the product does not exist.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Product p set p.price = :price where p.id = :productId")
    int updatePrice(@Param("productId") Long productId, @Param("price") BigDecimal price);
}
