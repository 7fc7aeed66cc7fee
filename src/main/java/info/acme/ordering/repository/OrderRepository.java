package info.acme.ordering.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import info.acme.ordering.domain.Order;
import info.acme.ordering.domain.OrderStatus;

/**
 * Repository interface for managing {@link Order} entities.
 * <p>
 * Every lookup by order id is scoped to the owning account's email, so an order
 * that belongs to someone else is indistinguishable from one that does not
 * exist.
 * </p>
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, Long> {
    /**
     * Finds an order by id if it belongs to the account with the given email.
     *
     * @param orderId The order id.
     * @param email   The owner's email.
     * @return The order, or empty if absent or owned by another account.
     */
    @Query("select o from Order o where o.id = :orderId and o.account.email = :email")
    Optional<Order> findOwnedOrder(@Param("orderId") Long orderId, @Param("email") String email);

    /**
     * Same as {@link #findOwnedOrder(Long, String)} but fetches the items and
     * their products in the same query.
     *
     * @param orderId The order id.
     * @param email   The owner's email.
     * @return The order with initialized items, or empty.
     */
    @Query("select distinct o from Order o left join fetch o.items i left join fetch i.product "
            + "where o.id = :orderId and o.account.email = :email")
    Optional<Order> findOwnedOrderWithItems(@Param("orderId") Long orderId, @Param("email") String email);

    /**
     * Finds all orders of an account in storage order.
     *
     * @param accountId The account id.
     * @return The account's orders, possibly empty.
     */
    List<Order> findByAccount_IdOrderByIdAsc(Long accountId);

    /**
     * Moves an order to {@code target} in a single conditional statement. The
     * row only matches when the order belongs to the account with the given
     * email and its current status is one of {@code fromStatuses}.
     *
     * @param orderId      The order id.
     * @param email        The owner's email.
     * @param target       The new status.
     * @param fromStatuses The statuses the order may currently be in.
     * @return The number of rows updated.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Order o set o.status = :target where o.id = :orderId "
            + "and o.account.id = (select a.id from Account a where a.email = :email) "
            + "and o.status in :fromStatuses")
    int updateStatusForOwner(@Param("orderId") Long orderId, @Param("email") String email,
            @Param("target") OrderStatus target, @Param("fromStatuses") Collection<OrderStatus> fromStatuses);
}
