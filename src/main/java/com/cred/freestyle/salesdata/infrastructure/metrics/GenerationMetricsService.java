package com.cred.freestyle.salesdata.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for the sales data generator, published through Micrometer.
 *
 * Key Metrics:
 * - Orders and order items generated
 * - Persistence failures by stage (header, item, stock, reconcile) and kind
 * - Simulated revenue
 * - Metric backfill assignments and failures
 * - Run latency and errors
 *
 * @author Sales Data Team
 */
@Service
public class GenerationMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(GenerationMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "salesdata.";
    private static final String GENERATOR_PREFIX = METRIC_PREFIX + "generator.";
    private static final String BACKFILL_PREFIX = METRIC_PREFIX + "backfill.";

    public GenerationMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a persisted order header.
     */
    public void recordOrderGenerated() {
        Counter.builder(GENERATOR_PREFIX + "orders")
                .description("Simulated orders persisted")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a persisted order item.
     *
     * @param category Category name of the sold product
     */
    public void recordOrderItemGenerated(String category) {
        Counter.builder(GENERATOR_PREFIX + "order_items")
                .tag("category", category)
                .description("Simulated order items persisted")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a skipped record.
     *
     * @param stage Where the failure happened ("order", "order_item", "stock", "reconcile")
     * @param kind Failure kind (e.g., "PERSISTENCE", "UNEXPECTED")
     */
    public void recordPersistenceFailure(String stage, String kind) {
        Counter.builder(GENERATOR_PREFIX + "failures")
                .tag("stage", stage)
                .tag("kind", kind)
                .description("Records skipped by the generator")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded persistence failure, stage: {}, kind: {}", stage, kind);
    }

    /**
     * Record revenue of a persisted order.
     *
     * @param amount Order total
     */
    public void recordRevenue(double amount) {
        Counter.builder(GENERATOR_PREFIX + "revenue")
                .description("Simulated revenue")
                .register(meterRegistry)
                .increment(amount);
    }

    /**
     * Record a full generation run.
     *
     * @param durationMs Run duration in milliseconds
     */
    public void recordRunLatency(long durationMs) {
        Timer.builder(GENERATOR_PREFIX + "run.latency")
                .description("Duration of a generation run")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record orders removed by a clear request.
     *
     * @param ordersDeleted Deleted order count
     */
    public void recordHistoryCleared(long ordersDeleted) {
        Counter.builder(GENERATOR_PREFIX + "cleared_orders")
                .description("Orders removed before a generation run")
                .register(meterRegistry)
                .increment(ordersDeleted);
        logger.info("Recorded history clear: {} orders", ordersDeleted);
    }

    /**
     * Record a metric assigned by the backfill.
     *
     * @param field "rating" or "energy"
     */
    public void recordMetricAssigned(String field) {
        Counter.builder(BACKFILL_PREFIX + "assigned")
                .tag("field", field)
                .description("Product metrics assigned by the backfill")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a backfill failure for one product.
     */
    public void recordBackfillFailure() {
        Counter.builder(BACKFILL_PREFIX + "failures")
                .description("Products whose metrics could not be derived or stored")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record application error.
     *
     * @param errorType Error type
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "errors")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Application errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: {} in operation: {}", errorType, operation);
    }
}
