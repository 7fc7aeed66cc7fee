package info.acme.ordering.dto;

import java.math.BigDecimal;

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
@Relation(collectionRelation = "products", itemRelation = "product")
@Schema(description = "A catalog product")
public class ProductResponseDTO extends RepresentationModel<ProductResponseDTO> {
    @Schema(description = "Unique identifier of the product", example = "123769")
    private Long id;

    @Schema(description = "Name of the product", example = "Earthquake Pills")
    private String name;

    @Schema(description = "Description of the product", example = "Instant Earthquakes! Why wait?")
    private String description;

    @Schema(description = "Current unit price", example = "17.65")
    private BigDecimal price;

    @Schema(description = "Keywords associated with the product", example = "[\"shake\",\"quake\",\"pills\"]")
    private String keywords;

    @Schema(description = "Number of units available", example = "14")
    private Integer available;
}
