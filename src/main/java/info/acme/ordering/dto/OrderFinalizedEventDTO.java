package info.acme.ordering.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonFormat;

import info.acme.ordering.domain.OrderStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class OrderFinalizedEventDTO {
    private Long orderId;
    private Long accountId;
    private OrderStatus status;
    private BigDecimal totalAmount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private LocalDateTime finalizedAt;
}
