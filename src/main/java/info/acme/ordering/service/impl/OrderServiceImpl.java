package info.acme.ordering.service.impl;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import info.acme.ordering.domain.Account;
import info.acme.ordering.domain.Order;
import info.acme.ordering.domain.OrderItem;
import info.acme.ordering.domain.OrderStatus;
import info.acme.ordering.domain.Product;
import info.acme.ordering.event.OrderFinalizedEvent;
import info.acme.ordering.exception.InvalidInputException;
import info.acme.ordering.exception.InvalidOrderException;
import info.acme.ordering.exception.OrderFinalizedException;
import info.acme.ordering.exception.UnknownProductException;
import info.acme.ordering.identity.CallerIdentity;
import info.acme.ordering.repository.OrderRepository;
import info.acme.ordering.service.AccountService;
import info.acme.ordering.service.OrderService;
import info.acme.ordering.service.ProductService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderService} interface.
 * <p>
 * Each public method runs in one transaction, so an order and its items are
 * either written together or not at all. There is no optimistic locking: two
 * concurrent amendments of the same order resolve as last writer wins.
 * </p>
 * <p>
 * Finalization also guards on the current status: the conditional update only
 * matches a pending order or one already in the requested status. A plain
 * ownership-guarded update would let a submitted order be canceled (or the
 * reverse); this guard keeps terminal statuses terminal, and the other
 * terminal status is reported as {@link OrderFinalizedException}.
 * </p>
 * <p>
 * Totals and prices are bounded by the {@code DECIMAL(10,2)} columns; an order
 * whose recomputed total exceeds {@link Order#MAX_TOTAL_AMOUNT} is rejected
 * with {@link InvalidInputException} before anything is written.
 * </p>
 */
@Service
@Slf4j
public class OrderServiceImpl implements OrderService {
    public static final int MAX_PRODUCTS_PER_ORDER = 5;

    private final OrderRepository orderRepository;
    private final AccountService accountService;
    private final ProductService productService;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    private Timer orderCreationTimer;
    private Counter ordersCreatedCounter;
    private Counter ordersAmendedCounter;

    /**
     * Constructs an instance of {@code OrderServiceImpl}.
     *
     * @param orderRepository The repository for order data access.
     * @param accountService  Resolves callers to accounts.
     * @param productService  Looks up catalog products.
     * @param eventPublisher  The application event publisher for order events.
     * @param meterRegistry   The registry for collecting metrics.
     */
    public OrderServiceImpl(OrderRepository orderRepository, AccountService accountService,
            ProductService productService, ApplicationEventPublisher eventPublisher, MeterRegistry meterRegistry) {
        this.orderRepository = orderRepository;
        this.accountService = accountService;
        this.productService = productService;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;

        initializeMetrics(this.meterRegistry);
    }

    /**
     * Creates a pending order. The total is the sum of the current prices of the
     * listed products, counting repeated ids once per occurrence.
     */
    @Override
    @Transactional
    public Order createOrder(CallerIdentity caller, List<Long> productIds) {
        return this.orderCreationTimer.record(() -> {
            Account account = accountService.resolveCaller(caller);

            if (productIds == null || productIds.isEmpty() || productIds.size() > MAX_PRODUCTS_PER_ORDER
                    || productIds.stream().anyMatch(Objects::isNull)) {
                log.warn("Rejected order for account {} with product list {}", account.getId(), productIds);
                throw new InvalidInputException(
                        "invalid products list. Must be an array of 1 to " + MAX_PRODUCTS_PER_ORDER + " product IDs.");
            }

            Map<Long, Product> productsById = loadProducts(new LinkedHashSet<>(productIds));

            Order order = Order.builder()
                    .account(account)
                    .status(OrderStatus.PENDING)
                    .build();

            productIds.forEach(productId -> order.addItem(OrderItem.builder()
                    .product(productsById.get(productId))
                    .quantity(1)
                    .build()));

            order.recalculateTotal();
            checkTotal(order);

            Order savedOrder = orderRepository.save(order);
            ordersCreatedCounter.increment();
            log.info("Created order {} for account {} with {} items, total {}", savedOrder.getId(), account.getId(),
                    productIds.size(), savedOrder.getTotalAmount());

            return savedOrder;
        });
    }

    @Override
    @Transactional
    public Order amendOrder(CallerIdentity caller, Long orderId, Long productId, int quantity) {
        Order order = findOwned(caller, orderId, true);

        if (!order.isPending()) {
            log.warn("Rejected amendment of order {} in status {}", orderId, order.getStatus());
            throw new OrderFinalizedException(orderId, order.getStatus());
        }
        if (productId == null) {
            throw new InvalidInputException("A product ID is required to amend an order.");
        }
        if (quantity <= 0) {
            log.warn("Rejected amendment of order {} with quantity {}", orderId, quantity);
            throw new InvalidInputException("Quantity must be a positive integer.");
        }

        Product product = loadProducts(Set.of(productId)).get(productId);

        order.amendItem(product, quantity);
        order.recalculateTotal();
        checkTotal(order);

        Order savedOrder = orderRepository.saveAndFlush(order);
        ordersAmendedCounter.increment();
        log.info("Amended order {}: product {} now at quantity {}, total {}", orderId, productId, quantity,
                savedOrder.getTotalAmount());

        return savedOrder;
    }

    /**
     * Finalizes an order with one conditional update that checks ownership and
     * current status in its {@code WHERE} clause. Only when nothing matched is
     * the order read, to tell a foreign or missing order apart from one that
     * was already finalized the other way.
     */
    @Override
    @Transactional
    public Order finalizeOrder(CallerIdentity caller, Long orderId, OrderStatus target) {
        if (target == null || !target.isTerminal()) {
            throw new InvalidInputException("An order can only be finalized as submitted or canceled.");
        }

        String email = caller == null ? null : caller.getEmail();
        int updated = orderRepository.updateStatusForOwner(orderId, email, target,
                EnumSet.of(OrderStatus.PENDING, target));

        if (updated == 0) {
            Order existing = orderRepository.findOwnedOrder(orderId, email)
                    .orElseThrow(() -> {
                        log.warn("Order {} not found for caller {}", orderId, email);
                        return new InvalidOrderException(orderId);
                    });

            log.warn("Rejected transition of order {} from {} to {}", orderId, existing.getStatus(), target);
            throw new OrderFinalizedException(orderId, existing.getStatus());
        }

        Order finalized = findOwned(caller, orderId, false);
        meterRegistry.counter("orders.finalized", "status", target.getValue()).increment();
        log.info("Order {} is now {}", orderId, target.getValue());

        eventPublisher.publishEvent(new OrderFinalizedEvent(this, finalized));

        return finalized;
    }

    @Override
    @Transactional(readOnly = true)
    public Order getOrder(CallerIdentity caller, Long orderId, boolean withItems) {
        return findOwned(caller, orderId, withItems);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> listOrders(CallerIdentity caller) {
        Account account = accountService.resolveCaller(caller);
        log.debug("Listing orders for account {}", account.getId());

        return orderRepository.findByAccount_IdOrderByIdAsc(account.getId());
    }

    private Order findOwned(CallerIdentity caller, Long orderId, boolean withItems) {
        String email = caller == null ? null : caller.getEmail();

        return (withItems
                ? orderRepository.findOwnedOrderWithItems(orderId, email)
                : orderRepository.findOwnedOrder(orderId, email))
                .orElseThrow(() -> {
                    log.warn("Order {} not found for caller {}", orderId, email);
                    return new InvalidOrderException(orderId);
                });
    }

    private void checkTotal(Order order) {
        if (order.getTotalAmount().compareTo(Order.MAX_TOTAL_AMOUNT) > 0) {
            log.warn("Rejected order {} with total {} above {}", order.getId(), order.getTotalAmount(),
                    Order.MAX_TOTAL_AMOUNT);
            throw new InvalidInputException(
                    "Order total cannot exceed " + Order.MAX_TOTAL_AMOUNT.toPlainString() + ".");
        }
    }

    /**
     * Loads the given products, failing when any of them is not in the catalog.
     *
     * @param productIds Distinct product ids.
     * @return The products keyed by id.
     * @throws UnknownProductException naming the ids that were not found.
     */
    private Map<Long, Product> loadProducts(Set<Long> productIds) {
        Map<Long, Product> productsById = productService.findByIds(productIds).stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));

        if (productsById.size() < productIds.size()) {
            List<Long> missing = productIds.stream()
                    .filter(id -> !productsById.containsKey(id))
                    .collect(Collectors.toList());
            log.warn("Unknown product ids requested: {}", missing);
            throw new UnknownProductException(missing);
        }

        return productsById;
    }

    /**
     * Initializes the Micrometer metrics for the order service.
     *
     * @param registry The meter registry to register the metrics with.
     */
    private void initializeMetrics(MeterRegistry registry) {
        this.orderCreationTimer = Timer.builder("orders.creation.time")
                .description("Time taken to create an order")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        this.ordersCreatedCounter = Counter.builder("orders.created")
                .description("Total number of orders created")
                .register(registry);
        this.ordersAmendedCounter = Counter.builder("orders.amended")
                .description("Total number of successful order amendments")
                .register(registry);
    }
}
