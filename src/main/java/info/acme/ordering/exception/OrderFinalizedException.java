package info.acme.ordering.exception;

import info.acme.ordering.domain.OrderStatus;

public class OrderFinalizedException extends RuntimeException {
    public OrderFinalizedException(Long orderId, OrderStatus status) {
        super("Order " + orderId + " is already " + status.getValue() + " and cannot be modified");
    }
}
