package com.cred.freestyle.salesdata.generator;

import java.math.BigDecimal;

/**
 * Running counters of one generation run. Not thread-safe; one instance per run.
 *
 * @author Sales Data Team
 */
public class GenerationStats {

    private long daysSimulated;
    private long ordersPersisted;
    private long lineItemsPersisted;
    private BigDecimal totalRevenue = BigDecimal.ZERO;

    private long headerFailures;
    private long lineFailures;
    private long stockUpdateFailures;
    private long reconcileFailures;
    private long reconciledOrders;
    private long emptyOrders;

    void daySimulated() {
        daysSimulated++;
    }

    void orderPersisted(BigDecimal storedTotal) {
        ordersPersisted++;
        totalRevenue = totalRevenue.add(storedTotal);
    }

    void lineItemPersisted() {
        lineItemsPersisted++;
    }

    void headerFailed() {
        headerFailures++;
    }

    void lineFailed() {
        lineFailures++;
    }

    void stockUpdateFailed() {
        stockUpdateFailures++;
    }

    void reconcileFailed() {
        reconcileFailures++;
    }

    void orderReconciled(boolean empty) {
        reconciledOrders++;
        if (empty) {
            emptyOrders++;
        }
    }

    public long getDaysSimulated() {
        return daysSimulated;
    }

    public long getOrdersPersisted() {
        return ordersPersisted;
    }

    public long getLineItemsPersisted() {
        return lineItemsPersisted;
    }

    public BigDecimal getTotalRevenue() {
        return totalRevenue;
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

    public long getReconcileFailures() {
        return reconcileFailures;
    }

    public long getReconciledOrders() {
        return reconciledOrders;
    }

    /**
     * Orders none of whose items could be stored; kept as CANCELLED with a zero total.
     */
    public long getEmptyOrders() {
        return emptyOrders;
    }

    @Override
    public String toString() {
        return "GenerationStats{" +
                "days=" + daysSimulated +
                ", orders=" + ordersPersisted +
                ", items=" + lineItemsPersisted +
                ", revenue=" + totalRevenue +
                ", headerFailures=" + headerFailures +
                ", lineFailures=" + lineFailures +
                ", stockUpdateFailures=" + stockUpdateFailures +
                ", reconciledOrders=" + reconciledOrders +
                '}';
    }
}
