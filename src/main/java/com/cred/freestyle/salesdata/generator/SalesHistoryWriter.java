package com.cred.freestyle.salesdata.generator;

import com.cred.freestyle.salesdata.domain.model.Customer;
import com.cred.freestyle.salesdata.domain.model.Order;
import com.cred.freestyle.salesdata.domain.model.Order.OrderStatus;
import com.cred.freestyle.salesdata.domain.model.OrderItem;
import com.cred.freestyle.salesdata.exception.HistoryClearException;
import com.cred.freestyle.salesdata.infrastructure.metrics.GenerationMetricsService;
import com.cred.freestyle.salesdata.repository.OrderItemRepository;
import com.cred.freestyle.salesdata.repository.OrderRepository;
import com.cred.freestyle.salesdata.repository.ProductRepository;
import com.cred.freestyle.salesdata.seed.CatalogSnapshot;
import com.cred.freestyle.salesdata.simulation.Basket;
import com.cred.freestyle.salesdata.simulation.BasketLine;
import com.cred.freestyle.salesdata.simulation.BasketSampler;
import com.cred.freestyle.salesdata.simulation.DemandCurveModel;
import com.cred.freestyle.salesdata.simulation.SimulationWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Random;

/**
 * Writes simulated order history day by day.
 *
 * Per simulated day:
 * 1. Ask the demand curve how many orders the day gets
 * 2. For each order: pick a buyer, draw a basket, store the header with the simulated timestamp
 * 3. Store each basket line separately and decrement the product's stock (floored at zero)
 * 4. If some lines could not be stored, bring the header total in line with the stored lines
 *
 * Every header, line, stock decrement and reconciliation runs in its own isolated unit of work.
 * A failure skips only that record; it is counted in {@link GenerationStats} and the loop goes on.
 * The run as a whole is deliberately not transactional, so a late failure never discards
 * history that was already written.
 *
 * @author Sales Data Team
 */
@Component
public class SalesHistoryWriter {

    private static final Logger logger = LoggerFactory.getLogger(SalesHistoryWriter.class);

    static final int FIRST_ORDER_HOUR = 8;
    static final int LAST_ORDER_HOUR = 20;

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final ProductRepository productRepository;
    private final IsolatedUnitOfWork unitOfWork;
    private final TransactionTemplate clearTransaction;
    private final GenerationMetricsService metricsService;
    private final BasketSampler basketSampler;
    private final Random random;
    private final Clock clock;

    public SalesHistoryWriter(
            OrderRepository orderRepository,
            OrderItemRepository orderItemRepository,
            ProductRepository productRepository,
            IsolatedUnitOfWork unitOfWork,
            PlatformTransactionManager transactionManager,
            GenerationMetricsService metricsService,
            Random random,
            Clock clock
    ) {
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.productRepository = productRepository;
        this.unitOfWork = unitOfWork;
        this.clearTransaction = new TransactionTemplate(transactionManager);
        this.metricsService = metricsService;
        this.basketSampler = new BasketSampler(random);
        this.random = random;
        this.clock = clock;
    }

    /**
     * Remove all existing orders and order items in one transaction.
     * Either everything is deleted or nothing is.
     *
     * @return Number of orders deleted
     * @throws HistoryClearException if the delete fails
     */
    public long clearHistory() {
        logger.info("Clearing existing order history");
        try {
            Long deleted = clearTransaction.execute(status -> {
                long orders = orderRepository.count();
                orderItemRepository.deleteAllInBatch();
                orderRepository.deleteAllInBatch();
                return orders;
            });
            long count = deleted != null ? deleted : 0L;
            metricsService.recordHistoryCleared(count);
            logger.info("Removed {} existing orders", count);
            return count;
        } catch (RuntimeException e) {
            logger.error("Failed to clear existing order history", e);
            metricsService.recordError("HISTORY_CLEAR_ERROR", "clearHistory");
            throw new HistoryClearException("Could not clear existing order history", e);
        }
    }

    /**
     * Simulate every day of the demand curve's window.
     *
     * @param demandCurve Demand model (carries the simulation window)
     * @param catalog Products and popularity weights
     * @param customers Buyer pool, not empty
     * @return Counters of the run
     */
    public GenerationStats write(DemandCurveModel demandCurve, CatalogSnapshot catalog, List<Customer> customers) {
        if (catalog.isEmpty()) {
            throw new IllegalArgumentException("Cannot generate orders without products");
        }
        if (customers == null || customers.isEmpty()) {
            throw new IllegalArgumentException("Cannot generate orders without customers");
        }

        SimulationWindow window = demandCurve.getWindow();
        logger.info("Generating orders for {} days ({} .. {})",
                window.dayCount(), window.getStartDate(), window.getEndDate());

        GenerationStats stats = new GenerationStats();
        LocalDate day = window.getStartDate();
        while (!day.isAfter(window.getEndDate())) {
            int orderCount = demandCurve.dailyTransactionCount(day);
            for (int i = 0; i < orderCount; i++) {
                Customer customer = customers.get(random.nextInt(customers.size()));
                Basket basket = basketSampler.sample(catalog.getProducts(), catalog.getPopularity());
                writeOrder(day, customer, basket, stats);
            }
            stats.daySimulated();
            logger.debug("Simulated {}: {} orders requested", day, orderCount);
            day = day.plusDays(1);
        }

        logger.info("Generation finished: {}", stats);
        return stats;
    }

    /**
     * Persist one simulated order with its lines.
     *
     * @param day Simulated day
     * @param customer Buyer
     * @param basket Drawn basket
     * @param stats Counters to update
     * @return true if the header was stored
     */
    boolean writeOrder(LocalDate day, Customer customer, Basket basket, GenerationStats stats) {
        BigDecimal basketTotal = basket.total();
        Instant placedAt = simulatedInstant(day);

        PersistOutcome<Order> header = unitOfWork.run("order header", () -> {
            Order order = orderRepository.saveAndFlush(Order.builder()
                    .customerId(customer.getCustomerId())
                    .totalPrice(basketTotal)
                    .status(OrderStatus.COMPLETED)
                    .build());
            orderRepository.overrideTimestamps(order.getOrderId(), placedAt);
            return order;
        });

        if (!header.isSuccess()) {
            stats.headerFailed();
            metricsService.recordPersistenceFailure("order", header.getFailureKind().name());
            logger.warn("Skipping order on {} for customer {}: {}",
                    day, customer.getUsername(), header.getMessage());
            return false;
        }

        // detached from here on; keep the in-memory copy in line with the stored row
        Order order = header.getValue();
        order.setCreatedAt(placedAt);
        order.setUpdatedAt(placedAt);
        BigDecimal storedLinesTotal = BigDecimal.ZERO;
        int storedLines = 0;

        for (BasketLine line : basket.getLines()) {
            if (writeLine(order, line, stats)) {
                storedLines++;
                storedLinesTotal = storedLinesTotal.add(line.lineTotal());
            }
        }

        BigDecimal storedTotal = basketTotal;
        if (storedLines < basket.size()) {
            storedTotal = reconcile(order, storedLinesTotal, storedLines == 0, stats);
        }

        stats.orderPersisted(storedTotal);
        metricsService.recordOrderGenerated();
        metricsService.recordRevenue(storedTotal.doubleValue());
        return true;
    }

    private boolean writeLine(Order order, BasketLine line, GenerationStats stats) {
        PersistOutcome<OrderItem> item = unitOfWork.run("order item", () ->
                orderItemRepository.save(OrderItem.builder()
                        .orderId(order.getOrderId())
                        .productId(line.getProductId())
                        .quantity(line.getQuantity())
                        .unitPrice(line.getUnitPrice())
                        .build()));

        if (!item.isSuccess()) {
            stats.lineFailed();
            metricsService.recordPersistenceFailure("order_item", item.getFailureKind().name());
            logger.warn("Skipping item {} of order {}: {}", line, order.getOrderId(), item.getMessage());
            return false;
        }

        stats.lineItemPersisted();
        metricsService.recordOrderItemGenerated(line.getProduct().getCategoryName());

        // Best-effort: a stock failure never undoes the stored item
        PersistOutcome<Integer> stock = unitOfWork.run("stock decrement", () ->
                productRepository.decrementStock(line.getProductId(), line.getQuantity(), Instant.now(clock)));
        if (!stock.isSuccess() || stock.getValue() == null || stock.getValue() == 0) {
            stats.stockUpdateFailed();
            metricsService.recordPersistenceFailure("stock",
                    stock.isSuccess() ? "NOT_FOUND" : stock.getFailureKind().name());
            logger.debug("Stock of product {} not decremented", line.getProductId());
        }
        return true;
    }

    /**
     * Align the stored header with the lines that actually made it.
     *
     * @return Total now stored on the header
     */
    private BigDecimal reconcile(Order order, BigDecimal storedLinesTotal, boolean empty, GenerationStats stats) {
        OrderStatus status = empty ? OrderStatus.CANCELLED : OrderStatus.COMPLETED;
        PersistOutcome<Integer> reconciled = unitOfWork.run("order total reconciliation", () ->
                orderRepository.reconcileTotal(order.getOrderId(), storedLinesTotal, status));

        if (!reconciled.isSuccess()) {
            stats.reconcileFailed();
            metricsService.recordPersistenceFailure("reconcile", reconciled.getFailureKind().name());
            logger.warn("Order {} keeps its basket total {}: {}",
                    order.getOrderId(), order.getTotalPrice(), reconciled.getMessage());
            return order.getTotalPrice();
        }

        order.setTotalPrice(storedLinesTotal);
        order.setStatus(status);
        stats.orderReconciled(empty);
        logger.debug("Order {} reconciled to {} ({})", order.getOrderId(), storedLinesTotal, status);
        return storedLinesTotal;
    }

    /**
     * Instant on the given day between 08:00 and 20:59 in the generator zone.
     */
    Instant simulatedInstant(LocalDate day) {
        int hour = FIRST_ORDER_HOUR + random.nextInt(LAST_ORDER_HOUR - FIRST_ORDER_HOUR + 1);
        int minute = random.nextInt(60);
        return day.atTime(hour, minute).atZone(clock.getZone()).toInstant();
    }
}
