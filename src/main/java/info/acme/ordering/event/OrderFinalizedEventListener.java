package info.acme.ordering.event;

import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import info.acme.ordering.domain.Order;
import info.acme.ordering.dto.OrderFinalizedEventDTO;
import info.acme.ordering.mapper.OrderMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Event listener component that handles {@link OrderFinalizedEvent}.
 * This listener is triggered after the transaction that finalized the order is
 * successfully committed, so a rolled back finalization is never announced.
 * It converts the order into an {@link OrderFinalizedEventDTO} and publishes
 * it to a Kafka topic keyed by order id.
 */
@Component
@Slf4j
public class OrderFinalizedEventListener {
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final OrderMapper orderMapper;
    private final String ordersFinalizedTopic;

    public OrderFinalizedEventListener(KafkaTemplate<String, Object> kafkaTemplate, OrderMapper orderMapper,
            @Value("${app.kafka.orders-finalized-topic}") String ordersFinalizedTopic) {
        this.kafkaTemplate = kafkaTemplate;
        this.orderMapper = orderMapper;
        this.ordersFinalizedTopic = ordersFinalizedTopic;
    }

    /**
     * Sends the finalized order to {@code app.kafka.orders-finalized-topic}
     * asynchronously and logs the outcome. A failed send does not affect the
     * already committed order.
     *
     * @param event The {@link OrderFinalizedEvent} carrying the finalized order.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderFinalized(OrderFinalizedEvent event) {
        Order order = event.getFinalizedOrder();

        log.info("Received order finalized event for Order ID: {}", order.getId());
        OrderFinalizedEventDTO payload = orderMapper.toFinalizedEventDto(order);
        payload.setFinalizedAt(event.getFinalizedAt());

        String orderId = order.getId().toString();
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(ordersFinalizedTopic, orderId,
                    payload);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.info("Published order finalized event to topic {} for Order ID {}", ordersFinalizedTopic,
                            orderId);
                } else {
                    log.error("Failed to publish order finalized event to topic {} for Order ID {}: {}",
                            ordersFinalizedTopic, orderId, ex.getMessage(), ex);
                }
            });
        } catch (Exception e) {
            log.error("Exception while sending order finalized event to topic {} for Order ID {}: {}",
                    ordersFinalizedTopic, orderId, e.getMessage(), e);
        }
    }
}
