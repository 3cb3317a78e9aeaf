package com.cred.freestyle.salesdata.api.dto;

import com.cred.freestyle.salesdata.service.GenerationSummary;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Response DTO for a generation run.
 * Dates are ISO-8601 (yyyy-MM-dd); revenue has two decimals.
 *
 * @author Sales Data Team
 */
public class GenerationResponse {

    private long totalOrders;
    private BigDecimal totalRevenue;
    private String startDate;
    private String endDate;
    private int productsCount;
    private int customersCount;
    private long lineItems;
    private long headerFailures;
    private long lineFailures;
    private long stockUpdateFailures;

    public GenerationResponse() {
    }

    /**
     * Create response from a run summary.
     *
     * @param summary Generation summary
     * @return GenerationResponse
     */
    public static GenerationResponse fromSummary(GenerationSummary summary) {
        GenerationResponse response = new GenerationResponse();
        response.setTotalOrders(summary.getTotalOrders());
        response.setTotalRevenue(summary.getTotalRevenue().setScale(2, RoundingMode.HALF_UP));
        response.setStartDate(summary.getStartDate().toString());
        response.setEndDate(summary.getEndDate().toString());
        response.setProductsCount(summary.getProductsCount());
        response.setCustomersCount(summary.getCustomersCount());
        response.setLineItems(summary.getLineItems());
        response.setHeaderFailures(summary.getHeaderFailures());
        response.setLineFailures(summary.getLineFailures());
        response.setStockUpdateFailures(summary.getStockUpdateFailures());
        return response;
    }

    public long getTotalOrders() {
        return totalOrders;
    }

    public void setTotalOrders(long totalOrders) {
        this.totalOrders = totalOrders;
    }

    public BigDecimal getTotalRevenue() {
        return totalRevenue;
    }

    public void setTotalRevenue(BigDecimal totalRevenue) {
        this.totalRevenue = totalRevenue;
    }

    public String getStartDate() {
        return startDate;
    }

    public void setStartDate(String startDate) {
        this.startDate = startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    public void setEndDate(String endDate) {
        this.endDate = endDate;
    }

    public int getProductsCount() {
        return productsCount;
    }

    public void setProductsCount(int productsCount) {
        this.productsCount = productsCount;
    }

    public int getCustomersCount() {
        return customersCount;
    }

    public void setCustomersCount(int customersCount) {
        this.customersCount = customersCount;
    }

    public long getLineItems() {
        return lineItems;
    }

    public void setLineItems(long lineItems) {
        this.lineItems = lineItems;
    }

    public long getHeaderFailures() {
        return headerFailures;
    }

    public void setHeaderFailures(long headerFailures) {
        this.headerFailures = headerFailures;
    }

    public long getLineFailures() {
        return lineFailures;
    }

    public void setLineFailures(long lineFailures) {
        this.lineFailures = lineFailures;
    }

    public long getStockUpdateFailures() {
        return stockUpdateFailures;
    }

    public void setStockUpdateFailures(long stockUpdateFailures) {
        this.stockUpdateFailures = stockUpdateFailures;
    }
}
