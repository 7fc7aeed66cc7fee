package info.acme.ordering.controller;

import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.linkTo;
import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.methodOn;

import java.util.List;

import org.springframework.hateoas.CollectionModel;
import org.springframework.hateoas.MediaTypes;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import info.acme.ordering.domain.Product;
import info.acme.ordering.dto.AvailabilityUpdateRequestDTO;
import info.acme.ordering.dto.PriceUpdateRequestDTO;
import info.acme.ordering.dto.ProductResponseDTO;
import info.acme.ordering.mapper.ProductMapper;
import info.acme.ordering.service.ProductService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for reading and updating catalog products.
 */
@RestController
@RequestMapping("/api/v1/products")
@Tag(name = "Products API", description = "Endpoints for retrieving, searching and updating products")
@Slf4j
public class ProductController {
    private final ProductService productService;
    private final ProductMapper productMapper;

    public ProductController(ProductService productService, ProductMapper productMapper) {
        this.productService = productService;
        this.productMapper = productMapper;
    }

    @GetMapping(value = "/{productId}", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get a Product by ID", description = "Retrieves product details, including price and quantity available.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Product retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = ProductResponseDTO.class))),
            @ApiResponse(responseCode = "404", description = "Product not found", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ProductResponseDTO> findByProductId(@PathVariable Long productId) {
        return ResponseEntity.ok(toResponse(productService.getProduct(productId)));
    }

    @GetMapping(value = "/search", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Search Products", description = "Searches keywords, name and description for any of the terms separated by |.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Search completed", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = CollectionModel.class))),
            @ApiResponse(responseCode = "400", description = "Empty search expression", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CollectionModel<ProductResponseDTO>> searchProducts(@RequestParam("terms") String terms) {
        List<Product> products = productService.searchProducts(terms);

        List<ProductResponseDTO> responseDTOs = products.stream().map(this::toResponse).toList();

        CollectionModel<ProductResponseDTO> collectionModel = CollectionModel.of(responseDTOs);
        collectionModel.add(linkTo(methodOn(ProductController.class).searchProducts(terms)).withSelfRel());

        return ResponseEntity.ok(collectionModel);
    }

    @PutMapping(value = "/{productId}/price", consumes = MediaType.APPLICATION_JSON_VALUE, produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Update Product Price", description = "Updates the unit price of the product.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Price updated", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = ProductResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Price not positive or more than 2 decimal digits", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Product not found", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ProductResponseDTO> updatePrice(@PathVariable Long productId,
            @Validated @RequestBody PriceUpdateRequestDTO request) {
        return ResponseEntity.ok(toResponse(productService.setPrice(productId, request.getPrice())));
    }

    @PutMapping(value = "/{productId}/availability", consumes = MediaType.APPLICATION_JSON_VALUE, produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Update Product Availability", description = "Updates the available quantity of the product.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Availability updated", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = ProductResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Negative quantity", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Product not found", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ProductResponseDTO> updateAvailability(@PathVariable Long productId,
            @Validated @RequestBody AvailabilityUpdateRequestDTO request) {
        return ResponseEntity.ok(toResponse(productService.setAvailability(productId, request.getQuantity())));
    }

    private ProductResponseDTO toResponse(Product product) {
        ProductResponseDTO responseDTO = productMapper.toProductResponseDto(product);
        responseDTO.add(linkTo(methodOn(ProductController.class).findByProductId(product.getId())).withSelfRel());

        return responseDTO;
    }
}
