package com.cred.freestyle.salesdata.infrastructure.scheduler;

import com.cred.freestyle.salesdata.infrastructure.metrics.GenerationMetricsService;
import com.cred.freestyle.salesdata.service.BackfillSummary;
import com.cred.freestyle.salesdata.service.ProductMetricsBackfill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic backfill of missing product metrics (rating, yearly energy consumption).
 *
 * Disabled by default. Products created outside the generator pick up their metrics on the
 * next pass; products that already have them are left alone, so running it often is harmless.
 *
 * @author Sales Data Team
 */
@Service
public class ProductMetricsBackfillScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ProductMetricsBackfillScheduler.class);

    private final ProductMetricsBackfill metricsBackfill;
    private final GenerationMetricsService metricsService;

    @Value("${salesdata.metrics.backfill-scheduler.enabled:false}")
    private boolean schedulerEnabled;

    @Value("${salesdata.metrics.backfill-scheduler.limit:0}")
    private int limit;

    public ProductMetricsBackfillScheduler(
            ProductMetricsBackfill metricsBackfill,
            GenerationMetricsService metricsService
    ) {
        this.metricsBackfill = metricsBackfill;
        this.metricsService = metricsService;
    }

    /**
     * Nightly by default (03:00); the cron is configurable.
     */
    @Scheduled(cron = "${salesdata.metrics.backfill-scheduler.cron:0 0 3 * * *}")
    public void backfillMissingMetrics() {
        if (!schedulerEnabled) {
            logger.debug("Product metrics backfill scheduler is disabled");
            return;
        }

        long startTime = System.currentTimeMillis();
        try {
            BackfillSummary summary = metricsBackfill.backfillAll(limit);
            long duration = System.currentTimeMillis() - startTime;
            logger.info("Scheduled metrics backfill completed: {} checked, {} updated, {} failed, duration: {}ms",
                    summary.getProductsChecked(), summary.getProductsUpdated(), summary.getProductsFailed(), duration);
        } catch (Exception e) {
            logger.error("Error in product metrics backfill scheduler", e);
            metricsService.recordError("METRICS_BACKFILL_SCHEDULER_ERROR", "backfillMissingMetrics");
        }
    }
}
