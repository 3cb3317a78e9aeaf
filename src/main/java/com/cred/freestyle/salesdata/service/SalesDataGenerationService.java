package com.cred.freestyle.salesdata.service;

import com.cred.freestyle.salesdata.config.SalesDataProperties;
import com.cred.freestyle.salesdata.domain.model.Customer;
import com.cred.freestyle.salesdata.exception.GenerationInProgressException;
import com.cred.freestyle.salesdata.generator.GenerationStats;
import com.cred.freestyle.salesdata.generator.SalesHistoryWriter;
import com.cred.freestyle.salesdata.infrastructure.metrics.GenerationMetricsService;
import com.cred.freestyle.salesdata.seed.CatalogSnapshot;
import com.cred.freestyle.salesdata.seed.ReferenceDataBootstrap;
import com.cred.freestyle.salesdata.simulation.DemandCurveModel;
import com.cred.freestyle.salesdata.simulation.SimulationWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for generating simulated sales history and for the product metrics backfill.
 *
 * Generation flow:
 * 1. Optionally clear existing orders (all-or-nothing)
 * 2. Make sure the catalog and buyers exist
 * 3. Simulate the trailing window ending today, one isolated write per record
 *
 * Only one generation runs at a time; a concurrent request is rejected, not queued.
 *
 * @author Sales Data Team
 */
@Service
public class SalesDataGenerationService {

    private static final Logger logger = LoggerFactory.getLogger(SalesDataGenerationService.class);

    private final ReferenceDataBootstrap bootstrap;
    private final SalesHistoryWriter historyWriter;
    private final ProductMetricsBackfill metricsBackfill;
    private final GenerationMetricsService metricsService;
    private final SalesDataProperties properties;
    private final Random random;
    private final Clock clock;

    private final ReentrantLock runLock = new ReentrantLock();

    public SalesDataGenerationService(
            ReferenceDataBootstrap bootstrap,
            SalesHistoryWriter historyWriter,
            ProductMetricsBackfill metricsBackfill,
            GenerationMetricsService metricsService,
            SalesDataProperties properties,
            Random random,
            Clock clock
    ) {
        this.bootstrap = bootstrap;
        this.historyWriter = historyWriter;
        this.metricsBackfill = metricsBackfill;
        this.metricsService = metricsService;
        this.properties = properties;
        this.random = random;
        this.clock = clock;
    }

    /**
     * Generate simulated sales history for the configured window ending today.
     *
     * @param clearExisting Remove all existing orders first; otherwise the run appends
     * @return Run summary
     * @throws GenerationInProgressException if another run is active
     * @throws com.cred.freestyle.salesdata.exception.HistoryClearException if clearing fails
     */
    public GenerationSummary generate(boolean clearExisting) {
        if (!runLock.tryLock()) {
            logger.warn("Rejected generation request: another run is in progress");
            metricsService.recordError("GENERATION_IN_PROGRESS", "generate");
            throw new GenerationInProgressException();
        }

        long startTime = System.currentTimeMillis();
        try {
            long cleared = clearExisting ? historyWriter.clearHistory() : 0L;

            CatalogSnapshot catalog = bootstrap.ensureCatalog();
            List<Customer> customers = bootstrap.ensureCustomers();
            logger.info("Using {} products and {} customers", catalog.size(), customers.size());

            SimulationWindow window = SimulationWindow.trailing(clock, properties.getGenerator().getWindowDays());
            DemandCurveModel demandCurve = new DemandCurveModel(window, random);
            GenerationStats stats = historyWriter.write(demandCurve, catalog, customers);

            GenerationSummary summary = GenerationSummary.of(window, stats, catalog.size(), customers.size(), cleared);
            logger.info("Generated {} orders with revenue {} ({} .. {})",
                    summary.getTotalOrders(), summary.getTotalRevenue(),
                    summary.getStartDate(), summary.getEndDate());
            return summary;
        } finally {
            metricsService.recordRunLatency(System.currentTimeMillis() - startTime);
            runLock.unlock();
        }
    }

    /**
     * Assign missing rating and energy estimates across the stored catalog.
     *
     * @param limit Maximum number of products to check; 0 checks all
     * @return Backfill totals
     * @throws IllegalArgumentException if limit is negative
     */
    public BackfillSummary updateProductMetrics(int limit) {
        logger.info("Starting product metrics backfill, limit: {}", limit);
        return metricsBackfill.backfillAll(limit);
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }
}
