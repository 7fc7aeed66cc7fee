package info.acme.ordering.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.hateoas.RepresentationModel;
import org.springframework.hateoas.server.core.Relation;

import com.fasterxml.jackson.annotation.JsonInclude;

import info.acme.ordering.domain.OrderStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode(callSuper = false)
@Relation(collectionRelation = "orders", itemRelation = "order")
@Schema(description = "An order and, when requested, its items")
public class OrderResponseDTO extends RepresentationModel<OrderResponseDTO> {
    @Schema(description = "Unique identifier of the order", example = "42")
    private Long id;

    @Schema(description = "Identifier of the owning account", example = "1")
    private Long accountId;

    @Schema(description = "Timestamp when the order was created", example = "2025-04-01T20:00:00")
    private LocalDateTime orderDate;

    @Schema(description = "Current status of the order", example = "pending")
    private OrderStatus status;

    @Schema(description = "Sum of price times quantity over the current items", example = "35.00")
    private BigDecimal totalAmount;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "Items of the order, only present when details were requested")
    private List<OrderItemResponseDTO> items;
}
