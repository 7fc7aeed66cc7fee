package info.acme.ordering.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Sets the quantity of one product on a pending order")
public class OrderAmendRequestDTO {
    @NotNull(message = "Product ID cannot be null in amend request")
    @Schema(description = "ID of the product to add or update", example = "123769")
    private Long productId;

    @NotNull(message = "Quantity cannot be null in amend request")
    @Schema(description = "New quantity for the product, at least 1", example = "3")
    private Integer quantity;
}
