package info.acme.ordering.controller;

import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.linkTo;

import java.util.List;

import org.springframework.hateoas.CollectionModel;
import org.springframework.hateoas.Link;
import org.springframework.hateoas.MediaTypes;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import info.acme.ordering.domain.Order;
import info.acme.ordering.domain.OrderStatus;
import info.acme.ordering.dto.OrderAmendRequestDTO;
import info.acme.ordering.dto.OrderRequestDTO;
import info.acme.ordering.dto.OrderResponseDTO;
import info.acme.ordering.identity.CallerIdentity;
import info.acme.ordering.identity.CallerIdentityResolver;
import info.acme.ordering.mapper.OrderMapper;
import info.acme.ordering.service.OrderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for the order lifecycle of the calling account.
 * The caller is taken from the {@code user-info} header; every endpoint only
 * sees orders owned by that caller.
 * Uses HATEOAS to provide navigational links in responses.
 */
@RestController
@RequestMapping("/api/v1/orders")
@Tag(name = "Orders API", description = "Endpoints for creating, amending and finalizing orders")
@Slf4j
public class OrderController {
    private final OrderService orderService;
    private final OrderMapper orderMapper;
    private final CallerIdentityResolver callerIdentityResolver;

    /**
     * Constructs an instance of {@code OrderController}.
     *
     * @param orderService           Service for order-related operations.
     * @param orderMapper            Mapper for converting entities to DTOs.
     * @param callerIdentityResolver Resolves the caller from request headers.
     */
    public OrderController(OrderService orderService, OrderMapper orderMapper,
            CallerIdentityResolver callerIdentityResolver) {
        this.orderService = orderService;
        this.orderMapper = orderMapper;
        this.callerIdentityResolver = callerIdentityResolver;
    }

    /**
     * Creates a pending order with one unit of each listed product.
     *
     * @param userInfo The raw {@code user-info} header.
     * @param request  The product ids to order.
     * @return HTTP 201 with the created order.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Create an Order", description = "Creates a new pending order with 1 to 5 products.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Order created", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid product list", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller has no account", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Unknown product ids", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderResponseDTO> createOrder(
            @Parameter(hidden = true) @RequestHeader(name = CallerIdentityResolver.USER_INFO_HEADER, required = false) String userInfo,
            @Validated @RequestBody OrderRequestDTO request) {
        CallerIdentity caller = callerIdentityResolver.resolve(userInfo);
        Order order = orderService.createOrder(caller, request.getProductIds());

        OrderResponseDTO responseDTO = toResponse(order, false);
        Link selfLink = selfLink(order.getId());

        return ResponseEntity.created(selfLink.toUri()).body(responseDTO);
    }

    /**
     * Lists all orders of the caller.
     *
     * @param userInfo The raw {@code user-info} header.
     * @return A {@link CollectionModel} of the caller's orders.
     */
    @GetMapping(produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "List My Orders", description = "Lists all orders of the calling account.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Orders retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = CollectionModel.class))),
            @ApiResponse(responseCode = "403", description = "Caller has no account", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CollectionModel<OrderResponseDTO>> listOrders(
            @Parameter(hidden = true) @RequestHeader(name = CallerIdentityResolver.USER_INFO_HEADER, required = false) String userInfo) {
        CallerIdentity caller = callerIdentityResolver.resolve(userInfo);
        List<Order> orders = orderService.listOrders(caller);

        List<OrderResponseDTO> responseDTOs = orderMapper.toOrderResponseDtoList(orders);
        responseDTOs.forEach(dto -> dto.add(selfLink(dto.getId())));

        CollectionModel<OrderResponseDTO> collectionModel = CollectionModel.of(responseDTOs);
        collectionModel.add(linkTo(OrderController.class).withSelfRel());

        return ResponseEntity.ok(collectionModel);
    }

    /**
     * Retrieves one of the caller's orders.
     *
     * @param userInfo The raw {@code user-info} header.
     * @param orderId  The id of the order.
     * @param details  Whether to include the order items.
     * @return The order, with items when requested.
     */
    @GetMapping(value = "/{orderId}", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get an Order by ID", description = "Retrieves an order of the calling account, optionally with its items.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid identifier", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the caller", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderResponseDTO> findByOrderId(
            @Parameter(hidden = true) @RequestHeader(name = CallerIdentityResolver.USER_INFO_HEADER, required = false) String userInfo,
            @PathVariable Long orderId,
            @RequestParam(name = "details", defaultValue = "false") boolean details) {
        CallerIdentity caller = callerIdentityResolver.resolve(userInfo);
        Order order = orderService.getOrder(caller, orderId, details);

        return ResponseEntity.ok(toResponse(order, details));
    }

    /**
     * Sets the quantity of a product on a pending order.
     *
     * @param userInfo The raw {@code user-info} header.
     * @param orderId  The id of the order.
     * @param request  The product and its new quantity.
     * @return The amended order with its items.
     */
    @PutMapping(value = "/{orderId}/items", consumes = MediaType.APPLICATION_JSON_VALUE, produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Amend an Order", description = "Adds a product to a pending order or updates its quantity, then re-prices the order.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order amended", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid quantity", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the caller", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Order already finalized", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Unknown product id", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderResponseDTO> amendOrder(
            @Parameter(hidden = true) @RequestHeader(name = CallerIdentityResolver.USER_INFO_HEADER, required = false) String userInfo,
            @PathVariable Long orderId,
            @Validated @RequestBody OrderAmendRequestDTO request) {
        CallerIdentity caller = callerIdentityResolver.resolve(userInfo);
        Order order = orderService.amendOrder(caller, orderId, request.getProductId(), request.getQuantity());

        return ResponseEntity.ok(toResponse(order, true));
    }

    /**
     * Submits a pending order.
     *
     * @param userInfo The raw {@code user-info} header.
     * @param orderId  The id of the order.
     * @return The submitted order.
     */
    @PostMapping(value = "/{orderId}/submit", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Submit an Order", description = "Submits a pending order.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order submitted", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the caller", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Order was canceled", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderResponseDTO> submitOrder(
            @Parameter(hidden = true) @RequestHeader(name = CallerIdentityResolver.USER_INFO_HEADER, required = false) String userInfo,
            @PathVariable Long orderId) {
        return finalizeOrder(userInfo, orderId, OrderStatus.SUBMITTED);
    }

    /**
     * Cancels a pending order.
     *
     * @param userInfo The raw {@code user-info} header.
     * @param orderId  The id of the order.
     * @return The canceled order.
     */
    @PostMapping(value = "/{orderId}/cancel", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Cancel an Order", description = "Cancels a pending order.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order canceled", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the caller", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Order was submitted", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderResponseDTO> cancelOrder(
            @Parameter(hidden = true) @RequestHeader(name = CallerIdentityResolver.USER_INFO_HEADER, required = false) String userInfo,
            @PathVariable Long orderId) {
        return finalizeOrder(userInfo, orderId, OrderStatus.CANCELED);
    }

    private ResponseEntity<OrderResponseDTO> finalizeOrder(String userInfo, Long orderId, OrderStatus target) {
        CallerIdentity caller = callerIdentityResolver.resolve(userInfo);
        Order order = orderService.finalizeOrder(caller, orderId, target);

        return ResponseEntity.ok(toResponse(order, false));
    }

    private OrderResponseDTO toResponse(Order order, boolean withItems) {
        OrderResponseDTO responseDTO = orderMapper.toOrderResponseDto(order);

        if (withItems) {
            responseDTO.setItems(orderMapper.toOrderItemResponseDtoList(order.getItems()));
        }

        responseDTO.add(selfLink(order.getId()));
        responseDTO.add(linkTo(OrderController.class).withRel("orders"));

        return responseDTO;
    }

    private static Link selfLink(Long orderId) {
        return linkTo(OrderController.class).slash(orderId).withSelfRel();
    }
}
