package com.cred.freestyle.salesdata.api.dto;

import com.cred.freestyle.salesdata.service.BackfillSummary;

/**
 * Response DTO for the product metrics backfill.
 *
 * @author Sales Data Team
 */
public class BackfillResponse {

    private int productsChecked;
    private int productsUpdated;

    public BackfillResponse() {
    }

    public static BackfillResponse fromSummary(BackfillSummary summary) {
        BackfillResponse response = new BackfillResponse();
        response.setProductsChecked(summary.getProductsChecked());
        response.setProductsUpdated(summary.getProductsUpdated());
        return response;
    }

    public int getProductsChecked() {
        return productsChecked;
    }

    public void setProductsChecked(int productsChecked) {
        this.productsChecked = productsChecked;
    }

    public int getProductsUpdated() {
        return productsUpdated;
    }

    public void setProductsUpdated(int productsUpdated) {
        this.productsUpdated = productsUpdated;
    }
}
