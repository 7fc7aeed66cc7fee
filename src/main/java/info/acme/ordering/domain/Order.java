package info.acme.ordering.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.hibernate.annotations.CreationTimestamp;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Represents an order placed by an {@link Account}.
 * <p>
 * {@code totalAmount} always equals the sum of the line amounts of the
 * current items; every mutation of the item set must be followed by
 * {@link #recalculateTotal()} within the same transaction.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = { "items", "account" })
@EqualsAndHashCode(exclude = { "items", "account" })
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_account_id", columnList = "account_id"),
        @Index(name = "idx_order_status", columnList = "status")
})
public class Order {
    /**
     * Largest total the {@code DECIMAL(10,2)} column can hold.
     */
    public static final BigDecimal MAX_TOTAL_AMOUNT = new BigDecimal("99999999.99");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull(message = "Account cannot be null")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "account_id", nullable = false)
    private Account account;

    @CreationTimestamp
    @Column(nullable = false, updatable = false, name = "order_date")
    private LocalDateTime orderDate;

    @NotNull(message = "Order status cannot be null")
    @Convert(converter = OrderStatusConverter.class)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @NotNull(message = "Total amount cannot be null")
    @Column(nullable = false, name = "total_amount", precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @Builder.Default
    private List<OrderItem> items = new ArrayList<OrderItem>();

    /**
     * Adds an {@link OrderItem} to the order's item list and sets the bidirectional
     * relationship.
     *
     * @param item The {@link OrderItem} instance to add.
     */
    public void addItem(OrderItem item) {
        this.items.add(item);
        item.setOrder(this);
    }

    /**
     * Sets the quantity of {@code product} on this order.
     * <p>
     * When no item exists for the product a new one is added. Otherwise the
     * first matching item takes the new quantity and any further items for the
     * same product are removed, leaving exactly one row per product.
     * </p>
     *
     * @param product  The product to amend.
     * @param quantity The new quantity, positive.
     * @return The item now holding the quantity.
     */
    public OrderItem amendItem(Product product, int quantity) {
        List<OrderItem> matching = items.stream()
                .filter(item -> item.isFor(product.getId()))
                .collect(Collectors.toList());

        if (matching.isEmpty()) {
            OrderItem item = OrderItem.builder().product(product).quantity(quantity).build();
            addItem(item);
            return item;
        }

        OrderItem kept = matching.get(0);
        kept.setQuantity(quantity);

        for (OrderItem duplicate : matching.subList(1, matching.size())) {
            items.removeIf(item -> item == duplicate);
            duplicate.setOrder(null);
        }

        return kept;
    }

    /**
     * Recomputes {@code totalAmount} from the current items and the current
     * price of each item's product.
     *
     * @return The new total.
     */
    public BigDecimal recalculateTotal() {
        this.totalAmount = items.stream()
                .map(OrderItem::getLineAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        return this.totalAmount;
    }

    /**
     * Whether items and status may still change.
     *
     * @return {@code true} while the order is {@link OrderStatus#PENDING}.
     */
    public boolean isPending() {
        return status == OrderStatus.PENDING;
    }
}
