package info.acme.ordering.domain;

import java.math.BigDecimal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A line item of an order: one product and the quantity ordered.
 * No unit price is stored; the order total is derived from the product's
 * catalog price.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = { "order", "product" })
@EqualsAndHashCode(exclude = { "order", "product" })
@Entity
@Table(name = "order_items", indexes = {
        @Index(name = "idx_orderitem_order_id", columnList = "order_id"),
        @Index(name = "idx_orderitem_product_id", columnList = "product_id")
})
public class OrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    @NotNull(message = "Order cannot be null")
    private Order order;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "product_id", nullable = false)
    @NotNull(message = "Product cannot be null")
    private Product product;

    @NotNull(message = "Quantity cannot be null")
    @Min(value = 1, message = "Quantity must be at least 1")
    @Column(nullable = false)
    private Integer quantity;

    /**
     * Whether this item refers to the product with the given id.
     *
     * @param productId The product id to compare.
     * @return {@code true} if the item's product has that id.
     */
    public boolean isFor(Long productId) {
        return product != null && product.getId() != null && product.getId().equals(productId);
    }

    /**
     * The line amount at the product's current catalog price.
     *
     * @return {@code price × quantity}.
     */
    public BigDecimal getLineAmount() {
        return product.getPrice().multiply(BigDecimal.valueOf(quantity));
    }
}
