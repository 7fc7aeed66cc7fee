package info.acme.ordering.dto;

import org.springframework.hateoas.RepresentationModel;
import org.springframework.hateoas.server.core.Relation;

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
@Relation(collectionRelation = "orderItems", itemRelation = "orderItem")
@Schema(description = "Details of an item within an order response")
public class OrderItemResponseDTO extends RepresentationModel<OrderItemResponseDTO> {
    @Schema(description = "Unique identifier of the order item", example = "7")
    private Long id;

    @Schema(description = "Identifier of the ordered product", example = "123769")
    private Long productId;

    @Schema(description = "Name of the ordered product", example = "Earthquake Pills")
    private String productName;

    @Schema(description = "Number of units ordered for this product", example = "3")
    private Integer quantity;
}
