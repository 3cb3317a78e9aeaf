package com.cred.freestyle.salesdata.service;

/**
 * Outcome of backfilling one product's derived metrics.
 *
 * @author Sales Data Team
 */
public final class BackfillResult {

    private final String productId;
    private final boolean ratingAssigned;
    private final boolean energyAssigned;
    private final boolean failed;

    public BackfillResult(String productId, boolean ratingAssigned, boolean energyAssigned, boolean failed) {
        this.productId = productId;
        this.ratingAssigned = ratingAssigned;
        this.energyAssigned = energyAssigned;
        this.failed = failed;
    }

    public static BackfillResult unchanged(String productId) {
        return new BackfillResult(productId, false, false, false);
    }

    public String getProductId() {
        return productId;
    }

    public boolean isRatingAssigned() {
        return ratingAssigned;
    }

    public boolean isEnergyAssigned() {
        return energyAssigned;
    }

    /**
     * True if a derivation or write failed; the affected field stays unset for a later pass.
     */
    public boolean isFailed() {
        return failed;
    }

    public boolean isUpdated() {
        return ratingAssigned || energyAssigned;
    }
}
