package info.acme.ordering.service.impl;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.cache.annotation.CacheConfig;
import org.springframework.cache.annotation.CachePut;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import info.acme.ordering.domain.Product;
import info.acme.ordering.exception.InvalidInputException;
import info.acme.ordering.exception.ProductNotFoundException;
import info.acme.ordering.repository.ProductRepository;
import info.acme.ordering.service.ProductService;
import info.acme.ordering.util.SearchTerms;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link ProductService} interface.
 * Single product reads are cached by id; updates refresh the cached entry.
 * Order pricing does not go through the cache.
 */
@Service
@Slf4j
@CacheConfig(cacheNames = "product")
public class ProductServiceImpl implements ProductService {

    private final ProductRepository productRepository;

    public ProductServiceImpl(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    @Override
    @Transactional(readOnly = true)
    @Cacheable(key = "#productId")
    public Product getProduct(Long productId) {
        log.info("Cache miss, attempting to find product by ID from database: {}", productId);

        return productRepository.findById(productId)
                .orElseThrow(() -> {
                    log.warn("Product not found for ID: {}", productId);
                    return new ProductNotFoundException(productId);
                });
    }

    @Override
    @Transactional
    @CachePut(key = "#productId")
    public Product setAvailability(Long productId, int quantity) {
        if (quantity < 0) {
            log.warn("Rejected negative availability {} for product {}", quantity, productId);
            throw new InvalidInputException("Quantity must be a non-negative integer.");
        }

        int updated = productRepository.updateAvailable(productId, quantity);
        if (updated == 0) {
            log.warn("No product updated for ID: {}", productId);
            throw new ProductNotFoundException(productId);
        }

        log.info("Set availability of product {} to {}", productId, quantity);
        return reload(productId);
    }

    @Override
    @Transactional
    @CachePut(key = "#productId")
    public Product setPrice(Long productId, BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            log.warn("Rejected non-positive price {} for product {}", price, productId);
            throw new InvalidInputException("Price must be a positive number.");
        }
        if (price.compareTo(Product.MAX_PRICE) > 0) {
            log.warn("Rejected price {} above {} for product {}", price, Product.MAX_PRICE, productId);
            throw new InvalidInputException("Price cannot exceed " + Product.MAX_PRICE.toPlainString() + ".");
        }
        if (price.stripTrailingZeros().scale() > 2) {
            log.warn("Rejected price {} with more than 2 decimal digits for product {}", price, productId);
            throw new InvalidInputException("Price can have at most 2 decimal digits.");
        }

        int updated = productRepository.updatePrice(productId, price.setScale(2, RoundingMode.UNNECESSARY));
        if (updated == 0) {
            log.warn("No product updated for ID: {}", productId);
            throw new ProductNotFoundException(productId);
        }

        log.info("Set price of product {} to {}", productId, price);
        return reload(productId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Product> findByIds(Collection<Long> productIds) {
        log.debug("Attempting to find products by IDs: {}", productIds);

        return productRepository.findAllById(productIds);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Product> searchProducts(String termExpression) {
        List<String> terms = SearchTerms.parse(termExpression);
        if (terms.isEmpty()) {
            throw new InvalidInputException("Search expression must contain at least one term.");
        }

        Pattern pattern = SearchTerms.toPattern(terms);
        log.debug("Searching products with pattern {}", pattern.pattern());

        return productRepository.findAll().stream()
                .filter(product -> matches(pattern, product.getKeywords())
                        || matches(pattern, product.getName())
                        || matches(pattern, product.getDescription()))
                .collect(Collectors.toList());
    }

    private Product reload(Long productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    private static boolean matches(Pattern pattern, String value) {
        return value != null && pattern.matcher(value).find();
    }
}
