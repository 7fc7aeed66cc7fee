package info.acme.ordering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import com.jayway.jsonpath.JsonPath;

import info.acme.ordering.domain.Product;
import info.acme.ordering.dto.OrderFinalizedEventDTO;
import info.acme.ordering.identity.CallerIdentityResolver;
import info.acme.ordering.repository.ProductRepository;

/**
 * Runs the order lifecycle end to end over HTTP against an in-memory database.
 * Kafka is replaced by a mock template.
 */
@SpringBootTest
@AutoConfigureMockMvc
public class OrderLifecycleIntegrationTest {
    private static final String TOPIC = "orders.finalized.test";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ProductRepository productRepository;

    @MockitoBean
    private KafkaTemplate<String, Object> kafkaTemplate;

    private Long p1;
    private Long p2;
    private String alice;
    private String bob;

    @BeforeEach
    void setUp() throws Exception {
        given(kafkaTemplate.send(anyString(), anyString(), any())).willReturn(new CompletableFuture<>());

        p1 = productRepository.save(Product.builder().name("Earthquake Pills").description("Instant Earthquakes!")
                .price(new BigDecimal("10.00")).keywords("[\"shake\",\"quake\"]").available(14).build()).getId();
        p2 = productRepository.save(Product.builder().name("Hi-speed tonic").description("Lets one run super fast")
                .price(new BigDecimal("5.00")).keywords("[\"speed\",\"drink\"]").available(64).build()).getId();

        alice = registerCaller("Alice");
        bob = registerCaller("Bob");
    }

    private String registerCaller(String name) throws Exception {
        String header = "name=" + name + "; email=" + name.toLowerCase() + "-" + UUID.randomUUID() + "@example.com";
        mockMvc.perform(post("/api/v1/accounts").header(CallerIdentityResolver.USER_INFO_HEADER, header))
                .andExpect(status().isCreated());
        return header;
    }

    private ResultActions createOrder(String caller, Long... productIds) throws Exception {
        StringBuilder ids = new StringBuilder();
        for (Long id : productIds) {
            if (ids.length() > 0) {
                ids.append(',');
            }
            ids.append(id);
        }
        return mockMvc.perform(post("/api/v1/orders")
                .header(CallerIdentityResolver.USER_INFO_HEADER, caller)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"productIds\":[" + ids + "]}"));
    }

    private Long createdOrderId(String caller, Long... productIds) throws Exception {
        String body = createOrder(caller, productIds)
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return ((Number) JsonPath.read(body, "$.id")).longValue();
    }

    private ResultActions amend(String caller, Long orderId, Long productId, int quantity) throws Exception {
        return mockMvc.perform(put("/api/v1/orders/{id}/items", orderId)
                .header(CallerIdentityResolver.USER_INFO_HEADER, caller)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"productId\":" + productId + ",\"quantity\":" + quantity + "}"));
    }

    private ResultActions finalizeOrder(String caller, Long orderId, String action) throws Exception {
        return mockMvc.perform(post("/api/v1/orders/{id}/" + action, orderId)
                .header(CallerIdentityResolver.USER_INFO_HEADER, caller));
    }

    @Test
    @DisplayName("Create, amend, submit, then reject further amendments")
    void fullLifecycle() throws Exception {
        Long orderId = createdOrderId(alice, p1, p2);

        mockMvc.perform(get("/api/v1/orders/{id}", orderId).header(CallerIdentityResolver.USER_INFO_HEADER, alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("pending")))
                .andExpect(jsonPath("$.totalAmount", is(15.0)));

        amend(alice, orderId, p1, 3)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAmount", is(35.0)))
                .andExpect(jsonPath("$.items", hasSize(2)));

        finalizeOrder(alice, orderId, "submit")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("submitted")))
                .andExpect(jsonPath("$.totalAmount", is(35.0)));

        amend(alice, orderId, p2, 1)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title", is("Order Finalized")));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate, timeout(2000)).send(eq(TOPIC), eq(orderId.toString()), payload.capture());
        OrderFinalizedEventDTO event = (OrderFinalizedEventDTO) payload.getValue();
        assertThat(event.getOrderId()).isEqualTo(orderId);
        assertThat(event.getTotalAmount()).isEqualByComparingTo("35.00");
        assertThat(event.getFinalizedAt()).isNotNull();
    }

    @Test
    @DisplayName("Orders of other accounts behave as if they did not exist")
    void ownershipIsolation() throws Exception {
        Long orderId = createdOrderId(alice, p1);

        mockMvc.perform(get("/api/v1/orders/{id}", orderId).header(CallerIdentityResolver.USER_INFO_HEADER, bob))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title", is("Invalid Order")));
        amend(bob, orderId, p2, 1).andExpect(status().isNotFound());
        finalizeOrder(bob, orderId, "cancel").andExpect(status().isNotFound());

        mockMvc.perform(get("/api/v1/orders").header(CallerIdentityResolver.USER_INFO_HEADER, bob))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$._embedded").doesNotExist());

        mockMvc.perform(get("/api/v1/orders/{id}", orderId).header(CallerIdentityResolver.USER_INFO_HEADER, alice))
                .andExpect(jsonPath("$.status", is("pending")));
    }

    @Test
    @DisplayName("Price changes only reach an order when it is amended")
    void repricingOnAmendOnly() throws Exception {
        Long orderId = createdOrderId(alice, p1);

        mockMvc.perform(put("/api/v1/products/{id}/price", p1)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"price\":12.00}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.price", is(12.0)));

        mockMvc.perform(get("/api/v1/orders/{id}", orderId).header(CallerIdentityResolver.USER_INFO_HEADER, alice))
                .andExpect(jsonPath("$.totalAmount", is(10.0)));

        amend(alice, orderId, p2, 1)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAmount", is(17.0)));
    }

    @Test
    @DisplayName("A repeated product is counted per occurrence and collapsed on amendment")
    void repeatedProduct() throws Exception {
        String body = createOrder(alice, p1, p1)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.totalAmount", is(20.0)))
                .andReturn().getResponse().getContentAsString();
        Long orderId = ((Number) JsonPath.read(body, "$.id")).longValue();

        amend(alice, orderId, p1, 2)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].quantity", is(2)))
                .andExpect(jsonPath("$.totalAmount", is(20.0)));
    }

    @Test
    @DisplayName("A canceled order cannot be submitted and canceling again is harmless")
    void cancelThenSubmit() throws Exception {
        Long orderId = createdOrderId(alice, p2);

        finalizeOrder(alice, orderId, "cancel").andExpect(status().isOk());
        finalizeOrder(alice, orderId, "submit")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.detail", is("Order " + orderId + " is already canceled and cannot be modified")));
        finalizeOrder(alice, orderId, "cancel")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("canceled")));
    }

    @Test
    @DisplayName("Unknown products and bad lists create nothing")
    void invalidCreation() throws Exception {
        createOrder(alice, p1, 999999L)
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.missingProductIds", contains(999999)));
        createOrder(alice)
                .andExpect(status().isBadRequest());
        createOrder(alice, p1, p1, p1, p1, p1, p1)
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/orders").header(CallerIdentityResolver.USER_INFO_HEADER, alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$._embedded").doesNotExist());

        verify(kafkaTemplate, never()).send(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("Unregistered callers and duplicate registrations are rejected")
    void accountRules() throws Exception {
        createOrder("name=Ghost; email=ghost@example.com", p1)
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/v1/accounts").header(CallerIdentityResolver.USER_INFO_HEADER, alice))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/api/v1/accounts/me").header(CallerIdentityResolver.USER_INFO_HEADER, alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name", is("Alice")));
    }

    @Test
    @DisplayName("Amounts beyond the monetary columns are rejected as bad input")
    void amountsBeyondColumnRange() throws Exception {
        mockMvc.perform(put("/api/v1/products/{id}/price", p1)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"price\":123456789.99}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title", is("Invalid Input")));

        Long orderId = createdOrderId(alice, p1, p2);

        amend(alice, orderId, p1, 20_000_000)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", is("Order total cannot exceed 99999999.99.")));

        mockMvc.perform(get("/api/v1/orders/{id}", orderId).header(CallerIdentityResolver.USER_INFO_HEADER, alice))
                .andExpect(jsonPath("$.totalAmount", is(15.0)));
        mockMvc.perform(get("/api/v1/products/{id}", p1))
                .andExpect(jsonPath("$.price", is(10.0)));
    }

    @Test
    @DisplayName("Search matches plural terms against product text")
    void search() throws Exception {
        mockMvc.perform(get("/api/v1/products/search").param("terms", "quakes | nothing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$._embedded.products[*].id", hasItem(p1.intValue())));
    }
}
