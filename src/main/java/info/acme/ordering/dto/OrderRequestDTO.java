package info.acme.ordering.dto;

import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to create an order with one unit of each listed product")
public class OrderRequestDTO {
    @NotNull(message = "Product ID list cannot be null in order request")
    @Schema(description = "IDs of the products to add, 1 to 5 entries, repeats allowed", example = "[123769, 133833]")
    private List<Long> productIds;
}
