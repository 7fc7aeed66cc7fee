package info.acme.ordering.mapper;

import java.util.List;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Mappings;

import info.acme.ordering.domain.Order;
import info.acme.ordering.domain.OrderItem;
import info.acme.ordering.dto.OrderFinalizedEventDTO;
import info.acme.ordering.dto.OrderItemResponseDTO;
import info.acme.ordering.dto.OrderResponseDTO;

/**
 * Mapper interface for converting {@link Order} and {@link OrderItem} entities
 * into response and event DTOs using MapStruct.
 */
@Mapper(componentModel = "spring")
public interface OrderMapper {

    /**
     * Maps an {@link Order} entity to an {@link OrderResponseDTO} without its
     * items. Items are attached separately when details are requested.
     *
     * @param entity The source {@link Order} entity.
     * @return The mapped {@link OrderResponseDTO}.
     */
    @Mappings({
            @Mapping(source = "account.id", target = "accountId"),
            @Mapping(target = "items", ignore = true)
    })
    OrderResponseDTO toOrderResponseDto(Order entity);

    /**
     * Maps a list of {@link Order} entities to a list of {@link OrderResponseDTO}s.
     *
     * @param entityList The list of source {@link Order} entities.
     * @return A list of mapped {@link OrderResponseDTO}s.
     */
    List<OrderResponseDTO> toOrderResponseDtoList(List<Order> entityList);

    /**
     * Maps an {@link OrderItem} entity to an {@link OrderItemResponseDTO},
     * flattening the product id and name.
     *
     * @param entity The source {@link OrderItem} entity.
     * @return The mapped {@link OrderItemResponseDTO}.
     */
    @Mappings({
            @Mapping(source = "product.id", target = "productId"),
            @Mapping(source = "product.name", target = "productName")
    })
    OrderItemResponseDTO toOrderItemResponseDto(OrderItem entity);

    /**
     * Maps a list of {@link OrderItem} entities to a list of
     * {@link OrderItemResponseDTO}s.
     *
     * @param entityList The list of source {@link OrderItem} entities.
     * @return A list of mapped {@link OrderItemResponseDTO}s.
     */
    List<OrderItemResponseDTO> toOrderItemResponseDtoList(List<OrderItem> entityList);

    /**
     * Maps an {@link Order} entity to an {@link OrderFinalizedEventDTO}. The
     * finalization timestamp comes from the event and is set by the caller.
     *
     * @param entity The source {@link Order} entity.
     * @return The mapped {@link OrderFinalizedEventDTO}.
     */
    @Mappings({
            @Mapping(source = "id", target = "orderId"),
            @Mapping(source = "account.id", target = "accountId"),
            @Mapping(target = "finalizedAt", ignore = true)
    })
    OrderFinalizedEventDTO toFinalizedEventDto(Order entity);
}
