package info.acme.ordering.exception;

/**
 * Thrown when an order does not exist or is not owned by the caller. Both
 * cases produce the same message.
 */
public class InvalidOrderException extends RuntimeException {
    public InvalidOrderException(Long orderId) {
        super("invalid orderId: " + orderId);
    }
}
