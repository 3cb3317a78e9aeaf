package com.cred.freestyle.salesdata.service;

/**
 * Totals of a metric backfill pass over the catalog.
 *
 * @author Sales Data Team
 */
public final class BackfillSummary {

    private final int productsChecked;
    private final int productsUpdated;
    private final int productsFailed;

    public BackfillSummary(int productsChecked, int productsUpdated, int productsFailed) {
        this.productsChecked = productsChecked;
        this.productsUpdated = productsUpdated;
        this.productsFailed = productsFailed;
    }

    public int getProductsChecked() {
        return productsChecked;
    }

    public int getProductsUpdated() {
        return productsUpdated;
    }

    public int getProductsFailed() {
        return productsFailed;
    }

    @Override
    public String toString() {
        return "BackfillSummary{checked=" + productsChecked +
                ", updated=" + productsUpdated +
                ", failed=" + productsFailed + '}';
    }
}
