package info.acme.ordering.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityUpdateRequestDTO {
    @NotNull(message = "Quantity cannot be null in availability update request")
    @Schema(description = "New non-negative available quantity", example = "14")
    private Integer quantity;
}
