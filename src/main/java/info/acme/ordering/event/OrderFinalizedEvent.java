package info.acme.ordering.event;

import java.time.LocalDateTime;

import org.springframework.context.ApplicationEvent;

import info.acme.ordering.domain.Order;
import lombok.Getter;

/**
 * Internal event published when an order is submitted or canceled.
 */
@Getter
public class OrderFinalizedEvent extends ApplicationEvent {
    private final Order finalizedOrder;
    private final LocalDateTime finalizedAt;

    public OrderFinalizedEvent(Object source, Order finalizedOrder) {
        super(source);
        this.finalizedOrder = finalizedOrder;
        this.finalizedAt = LocalDateTime.now();
    }

}
