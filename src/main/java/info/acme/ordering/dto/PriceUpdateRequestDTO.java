package info.acme.ordering.dto;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceUpdateRequestDTO {
    @NotNull(message = "Price cannot be null in price update request")
    @Schema(description = "New positive unit price with at most 2 decimal digits", example = "17.65")
    private BigDecimal price;
}
