package info.acme.ordering.mapper;

import java.util.List;

import org.mapstruct.Mapper;

import info.acme.ordering.domain.Product;
import info.acme.ordering.dto.ProductResponseDTO;

/**
 * Mapper interface for converting {@link Product} entities into
 * {@link ProductResponseDTO}s using MapStruct.
 */
@Mapper(componentModel = "spring")
public interface ProductMapper {
    ProductResponseDTO toProductResponseDto(Product entity);

    List<ProductResponseDTO> toProductResponseDtoList(List<Product> entityList);
}
