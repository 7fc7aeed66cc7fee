package info.acme.ordering.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Represents the current status of an order.
 * An order starts as {@link #PENDING} and moves exactly once to one of the
 * terminal states, after which it is considered finalized.
 */
public enum OrderStatus {
    /**
     * Initial state. Items may still be amended.
     */
    PENDING("pending"),

    /**
     * The caller submitted the order. Terminal.
     */
    SUBMITTED("submitted"),

    /**
     * The caller canceled the order. Terminal.
     */
    CANCELED("canceled");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    /**
     * The representation stored in the {@code orders.status} column and used on
     * the wire.
     *
     * @return the lowercase status value.
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether no further transition may leave this state.
     *
     * @return {@code true} for {@link #SUBMITTED} and {@link #CANCELED}.
     */
    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Resolves a status from its stored value.
     *
     * @param value The lowercase status value (case is ignored).
     * @return The matching {@link OrderStatus}.
     * @throws IllegalArgumentException if the value does not name a status.
     */
    @JsonCreator
    public static OrderStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown order status: " + value));
    }
}
