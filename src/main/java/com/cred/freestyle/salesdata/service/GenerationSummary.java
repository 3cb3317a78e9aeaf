package com.cred.freestyle.salesdata.service;

import com.cred.freestyle.salesdata.generator.GenerationStats;
import com.cred.freestyle.salesdata.simulation.SimulationWindow;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Result of one generation run.
 *
 * @author Sales Data Team
 */
public final class GenerationSummary {

    private final long totalOrders;
    private final BigDecimal totalRevenue;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final int productsCount;
    private final int customersCount;
    private final long lineItems;
    private final long headerFailures;
    private final long lineFailures;
    private final long stockUpdateFailures;
    private final long ordersCleared;

    private GenerationSummary(SimulationWindow window, GenerationStats stats,
                              int productsCount, int customersCount, long ordersCleared) {
        this.totalOrders = stats.getOrdersPersisted();
        this.totalRevenue = stats.getTotalRevenue();
        this.startDate = window.getStartDate();
        this.endDate = window.getEndDate();
        this.productsCount = productsCount;
        this.customersCount = customersCount;
        this.lineItems = stats.getLineItemsPersisted();
        this.headerFailures = stats.getHeaderFailures();
        this.lineFailures = stats.getLineFailures();
        this.stockUpdateFailures = stats.getStockUpdateFailures();
        this.ordersCleared = ordersCleared;
    }

    public static GenerationSummary of(SimulationWindow window, GenerationStats stats,
                                       int productsCount, int customersCount, long ordersCleared) {
        return new GenerationSummary(window, stats, productsCount, customersCount, ordersCleared);
    }

    public long getTotalOrders() {
        return totalOrders;
    }

    /**
     * Exact sum of the stored order totals of this run.
     */
    public BigDecimal getTotalRevenue() {
        return totalRevenue;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public int getProductsCount() {
        return productsCount;
    }

    public int getCustomersCount() {
        return customersCount;
    }

    public long getLineItems() {
        return lineItems;
    }

    public long getHeaderFailures() {
        return headerFailures;
    }

    public long getLineFailures() {
        return lineFailures;
    }

    public long getStockUpdateFailures() {
        return stockUpdateFailures;
    }

    /**
     * Orders removed before the run; 0 when the run appended.
     */
    public long getOrdersCleared() {
        return ordersCleared;
    }

    @Override
    public String toString() {
        return "GenerationSummary{" +
                "totalOrders=" + totalOrders +
                ", totalRevenue=" + totalRevenue +
                ", startDate=" + startDate +
                ", endDate=" + endDate +
                ", productsCount=" + productsCount +
                ", customersCount=" + customersCount +
                ", lineItems=" + lineItems +
                ", headerFailures=" + headerFailures +
                ", lineFailures=" + lineFailures +
                ", stockUpdateFailures=" + stockUpdateFailures +
                '}';
    }
}
