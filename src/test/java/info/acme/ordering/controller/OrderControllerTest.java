package info.acme.ordering.controller;

import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.hateoas.MediaTypes;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import info.acme.ordering.domain.Account;
import info.acme.ordering.domain.Order;
import info.acme.ordering.domain.OrderItem;
import info.acme.ordering.domain.OrderStatus;
import info.acme.ordering.domain.Product;
import info.acme.ordering.exception.AccountNotRegisteredException;
import info.acme.ordering.exception.InvalidInputException;
import info.acme.ordering.exception.InvalidOrderException;
import info.acme.ordering.exception.OrderFinalizedException;
import info.acme.ordering.exception.UnknownProductException;
import info.acme.ordering.identity.CallerIdentity;
import info.acme.ordering.identity.CallerIdentityResolver;
import info.acme.ordering.mapper.OrderMapperImpl;
import info.acme.ordering.service.OrderService;

@WebMvcTest(OrderController.class)
@Import({ OrderMapperImpl.class, CallerIdentityResolver.class })
public class OrderControllerTest {
    private static final String BASE_API_URL = "/api/v1/orders";
    private static final String ALICE_HEADER = "name=Alice Johnson; email=alice@example.com";
    private static final CallerIdentity ALICE = new CallerIdentity("Alice Johnson", "alice@example.com");
    private static final CallerIdentity FALLBACK = new CallerIdentity("Bo Jackson", "bo@bojackson.com");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OrderService orderService;

    private Account account;
    private Product pills;
    private Product tonic;
    private Order order;

    @BeforeEach
    void setUp() {
        account = Account.builder().id(1L).name("Alice Johnson").email("alice@example.com").build();
        pills = Product.builder().id(123769L).name("Earthquake Pills").price(new BigDecimal("10.00")).available(5)
                .build();
        tonic = Product.builder().id(134421L).name("Hi-speed tonic").price(new BigDecimal("5.00")).available(5)
                .build();

        order = Order.builder()
                .id(42L)
                .account(account)
                .orderDate(LocalDateTime.of(2025, 4, 1, 20, 0, 0))
                .status(OrderStatus.PENDING)
                .build();
        order.addItem(OrderItem.builder().id(7L).product(pills).quantity(1).build());
        order.addItem(OrderItem.builder().id(8L).product(tonic).quantity(1).build());
        order.recalculateTotal();
    }

    @Nested
    @DisplayName("POST /orders Endpoint")
    class CreateOrderTests {

        @Test
        @DisplayName("Should return 201 Created with Location header and HATEOAS links")
        void createOrder_shouldReturnCreated() throws Exception {
            given(orderService.createOrder(eq(ALICE), eq(List.of(123769L, 134421L)))).willReturn(order);

            mockMvc.perform(post(BASE_API_URL)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"productIds\":[123769,134421]}"))
                    .andExpect(status().isCreated())
                    .andExpect(header().string("Location", endsWith(BASE_API_URL + "/42")))
                    .andExpect(content().contentType(MediaTypes.HAL_JSON))
                    .andExpect(jsonPath("$.id", is(42)))
                    .andExpect(jsonPath("$.accountId", is(1)))
                    .andExpect(jsonPath("$.status", is("pending")))
                    .andExpect(jsonPath("$.totalAmount", is(15.0)))
                    .andExpect(jsonPath("$.orderDate", is("2025-04-01T20:00:00")))
                    .andExpect(jsonPath("$.items").doesNotExist())
                    .andExpect(jsonPath("$._links.self.href", endsWith(BASE_API_URL + "/42")))
                    .andExpect(jsonPath("$._links.orders.href", endsWith(BASE_API_URL)));
        }

        @Test
        @DisplayName("Should use the fallback identity when no user-info header is sent")
        void createOrder_withoutHeader_shouldUseFallback() throws Exception {
            given(orderService.createOrder(eq(FALLBACK), anyList())).willReturn(order);

            mockMvc.perform(post(BASE_API_URL)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"productIds\":[123769]}"))
                    .andExpect(status().isCreated());

            verify(orderService).createOrder(eq(FALLBACK), eq(List.of(123769L)));
        }

        @Test
        @DisplayName("Should return 400 Bad Request when productIds is missing")
        void createOrder_withoutProductIds_shouldReturnBadRequest() throws Exception {
            mockMvc.perform(post(BASE_API_URL)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title", is("Invalid Request")));

            verify(orderService, never()).createOrder(any(), anyList());
        }

        @Test
        @DisplayName("Should return 400 Bad Request when the service rejects the list")
        void createOrder_withTooManyProducts_shouldReturnBadRequest() throws Exception {
            given(orderService.createOrder(eq(ALICE), anyList()))
                    .willThrow(new InvalidInputException("invalid products list. Must be an array of 1 to 5 product IDs."));

            mockMvc.perform(post(BASE_API_URL)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"productIds\":[1,2,3,4,5,6]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title", is("Invalid Input")))
                    .andExpect(jsonPath("$.detail", is("invalid products list. Must be an array of 1 to 5 product IDs.")));
        }

        @Test
        @DisplayName("Should return 422 with the missing ids when products are unknown")
        void createOrder_withUnknownProducts_shouldReturnUnprocessable() throws Exception {
            given(orderService.createOrder(eq(ALICE), anyList()))
                    .willThrow(new UnknownProductException(List.of(99L)));

            mockMvc.perform(post(BASE_API_URL)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"productIds\":[99]}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.title", is("Unknown Product")))
                    .andExpect(jsonPath("$.missingProductIds[0]", is(99)));
        }

        @Test
        @DisplayName("Should return 403 Forbidden when the caller has no account")
        void createOrder_unregisteredCaller_shouldReturnForbidden() throws Exception {
            given(orderService.createOrder(any(CallerIdentity.class), anyList()))
                    .willThrow(new AccountNotRegisteredException());

            mockMvc.perform(post(BASE_API_URL)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, "name=Nobody; email=nobody@example.com")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"productIds\":[1]}"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.detail", is("account not registered")));
        }
    }

    @Nested
    @DisplayName("GET /orders Endpoints")
    class GetOrderTests {

        @Test
        @DisplayName("Should return the order without items by default")
        void getOrder_withoutDetails() throws Exception {
            given(orderService.getOrder(ALICE, 42L, false)).willReturn(order);

            mockMvc.perform(get(BASE_API_URL + "/{id}", 42L)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id", is(42)))
                    .andExpect(jsonPath("$.items").doesNotExist());
        }

        @Test
        @DisplayName("Should include items when details are requested")
        void getOrder_withDetails() throws Exception {
            given(orderService.getOrder(ALICE, 42L, true)).willReturn(order);

            mockMvc.perform(get(BASE_API_URL + "/{id}", 42L)
                    .param("details", "true")
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.items", hasSize(2)))
                    .andExpect(jsonPath("$.items[0].productId", is(123769)))
                    .andExpect(jsonPath("$.items[0].productName", is("Earthquake Pills")))
                    .andExpect(jsonPath("$.items[0].quantity", is(1)));
        }

        @Test
        @DisplayName("Should return 404 Not Found for orders the caller does not own")
        void getOrder_notOwned() throws Exception {
            given(orderService.getOrder(ALICE, 7L, false)).willThrow(new InvalidOrderException(7L));

            mockMvc.perform(get(BASE_API_URL + "/{id}", 7L)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.title", is("Invalid Order")))
                    .andExpect(jsonPath("$.detail", is("invalid orderId: 7")));
        }

        @Test
        @DisplayName("Should return 400 Bad Request for a non-numeric id")
        void getOrder_invalidId() throws Exception {
            mockMvc.perform(get(BASE_API_URL + "/{id}", "abc")
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title", is("Invalid Identifier")));
        }

        @Test
        @DisplayName("Should list the caller's orders as an embedded collection")
        void listOrders() throws Exception {
            given(orderService.listOrders(ALICE)).willReturn(List.of(order));

            mockMvc.perform(get(BASE_API_URL)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$._embedded.orders", hasSize(1)))
                    .andExpect(jsonPath("$._embedded.orders[0].id", is(42)))
                    .andExpect(jsonPath("$._embedded.orders[0]._links.self.href", endsWith(BASE_API_URL + "/42")))
                    .andExpect(jsonPath("$._links.self.href", endsWith(BASE_API_URL)));
        }
    }

    @Nested
    @DisplayName("PUT /orders/{id}/items Endpoint")
    class AmendOrderTests {

        @Test
        @DisplayName("Should return the amended order with its items")
        void amendOrder_shouldReturnItems() throws Exception {
            order.amendItem(pills, 3);
            order.recalculateTotal();
            given(orderService.amendOrder(ALICE, 42L, 123769L, 3)).willReturn(order);

            mockMvc.perform(put(BASE_API_URL + "/{id}/items", 42L)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"productId\":123769,\"quantity\":3}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.totalAmount", is(35.0)))
                    .andExpect(jsonPath("$.items", hasSize(2)))
                    .andExpect(jsonPath("$.items[0].quantity", is(3)));
        }

        @Test
        @DisplayName("Should return 409 Conflict when the order is finalized")
        void amendOrder_finalized() throws Exception {
            given(orderService.amendOrder(ALICE, 42L, 123769L, 2))
                    .willThrow(new OrderFinalizedException(42L, OrderStatus.SUBMITTED));

            mockMvc.perform(put(BASE_API_URL + "/{id}/items", 42L)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"productId\":123769,\"quantity\":2}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.title", is("Order Finalized")));
        }

        @Test
        @DisplayName("Should return 400 Bad Request when quantity is missing")
        void amendOrder_missingQuantity() throws Exception {
            mockMvc.perform(put(BASE_API_URL + "/{id}/items", 42L)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"productId\":123769}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title", is("Invalid Request")));

            verify(orderService, never()).amendOrder(any(), anyLong(), anyLong(), anyInt());
        }

        @Test
        @DisplayName("Should return 400 Bad Request for malformed JSON")
        void amendOrder_malformedBody() throws Exception {
            mockMvc.perform(put(BASE_API_URL + "/{id}/items", 42L)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"productId\":"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title", is("Invalid Request")));
        }
    }

    @Nested
    @DisplayName("POST /orders/{id}/submit and /cancel Endpoints")
    class FinalizeOrderTests {

        @Test
        @DisplayName("Should submit the order")
        void submitOrder() throws Exception {
            order.setStatus(OrderStatus.SUBMITTED);
            given(orderService.finalizeOrder(ALICE, 42L, OrderStatus.SUBMITTED)).willReturn(order);

            mockMvc.perform(post(BASE_API_URL + "/{id}/submit", 42L)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status", is("submitted")))
                    .andExpect(jsonPath("$.items").doesNotExist());
        }

        @Test
        @DisplayName("Should cancel the order")
        void cancelOrder() throws Exception {
            order.setStatus(OrderStatus.CANCELED);
            given(orderService.finalizeOrder(ALICE, 42L, OrderStatus.CANCELED)).willReturn(order);

            mockMvc.perform(post(BASE_API_URL + "/{id}/cancel", 42L)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status", is("canceled")));
        }

        @Test
        @DisplayName("Should return 409 Conflict when canceling a submitted order")
        void cancelSubmittedOrder() throws Exception {
            given(orderService.finalizeOrder(ALICE, 42L, OrderStatus.CANCELED))
                    .willThrow(new OrderFinalizedException(42L, OrderStatus.SUBMITTED));

            mockMvc.perform(post(BASE_API_URL + "/{id}/cancel", 42L)
                    .header(CallerIdentityResolver.USER_INFO_HEADER, ALICE_HEADER))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.detail", is("Order 42 is already submitted and cannot be modified")));
        }
    }
}
