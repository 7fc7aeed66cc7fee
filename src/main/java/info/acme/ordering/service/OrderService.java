package info.acme.ordering.service;

import java.util.List;

import info.acme.ordering.domain.Order;
import info.acme.ordering.domain.OrderStatus;
import info.acme.ordering.identity.CallerIdentity;

/**
 * Order lifecycle operations. Every operation acts on behalf of a caller and
 * only ever sees orders owned by the caller's account.
 */
public interface OrderService {
    /**
     * Creates a pending order with one unit of each listed product. Repeated
     * ids produce repeated items.
     *
     * @param caller     The caller identity.
     * @param productIds Between 1 and 5 product ids.
     * @return The created order, priced at the current catalog prices.
     * @throws AccountNotRegisteredException if the caller has no account.
     * @throws InvalidInputException         if the list is empty or too long.
     * @throws UnknownProductException       if any id is not in the catalog.
     */
    Order createOrder(CallerIdentity caller, List<Long> productIds);

    /**
     * Sets the quantity of a product on a pending order and re-prices the whole
     * order from the current catalog.
     *
     * @param caller    The caller identity.
     * @param orderId   The order to amend.
     * @param productId The product whose quantity changes.
     * @param quantity  The new quantity, positive.
     * @return The amended order with its items.
     * @throws InvalidOrderException   if the caller owns no such order.
     * @throws OrderFinalizedException if the order is no longer pending.
     * @throws InvalidInputException   if the quantity is not positive.
     * @throws UnknownProductException if the product is not in the catalog.
     */
    Order amendOrder(CallerIdentity caller, Long orderId, Long productId, int quantity);

    /**
     * Moves a pending order to a terminal status.
     *
     * @param caller  The caller identity.
     * @param orderId The order to finalize.
     * @param target  {@link OrderStatus#SUBMITTED} or
     *                {@link OrderStatus#CANCELED}.
     * @return The finalized order.
     * @throws InvalidOrderException   if the caller owns no such order.
     * @throws OrderFinalizedException if the order already reached the other
     *                                 terminal status.
     * @throws InvalidInputException   if {@code target} is not terminal.
     */
    Order finalizeOrder(CallerIdentity caller, Long orderId, OrderStatus target);

    /**
     * Finds one of the caller's orders.
     *
     * @param caller    The caller identity.
     * @param orderId   The order id.
     * @param withItems Whether items and their products are loaded.
     * @return The order.
     * @throws InvalidOrderException if the caller owns no such order.
     */
    Order getOrder(CallerIdentity caller, Long orderId, boolean withItems);

    /**
     * Lists all orders of the caller's account.
     *
     * @param caller The caller identity.
     * @return The orders, possibly empty.
     * @throws AccountNotRegisteredException if the caller has no account.
     */
    List<Order> listOrders(CallerIdentity caller);
}
