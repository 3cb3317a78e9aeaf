package com.cred.freestyle.salesdata.simulation;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Relative popularity of catalog products, keyed by product ID.
 * Kept apart from the Product entity because popularity is a generator input, not a stored attribute.
 * Weights are clamped to [0, 1]; unknown products weigh {@link #DEFAULT_WEIGHT}.
 *
 * @author Sales Data Team
 */
public final class PopularityIndex {

    public static final double DEFAULT_WEIGHT = 0.5;

    private static final PopularityIndex EMPTY = new PopularityIndex(Collections.emptyMap());

    private final Map<String, Double> weights;

    private PopularityIndex(Map<String, Double> weights) {
        this.weights = weights;
    }

    public static PopularityIndex empty() {
        return EMPTY;
    }

    /**
     * @param weights product ID to weight; values outside [0, 1] are clamped, NaN becomes 0
     */
    public static PopularityIndex of(Map<String, Double> weights) {
        Map<String, Double> copy = new HashMap<>();
        weights.forEach((productId, weight) -> copy.put(productId, clamp(weight)));
        return new PopularityIndex(Collections.unmodifiableMap(copy));
    }

    /**
     * Weight used for sampling.
     *
     * @param productId Product ID
     * @return Known weight, or {@link #DEFAULT_WEIGHT}
     */
    public double weightOf(String productId) {
        Double weight = weights.get(productId);
        return weight != null ? weight : DEFAULT_WEIGHT;
    }

    /**
     * Known weight only; empty when the product has no recorded popularity.
     */
    public OptionalDouble find(String productId) {
        Double weight = weights.get(productId);
        return weight != null ? OptionalDouble.of(weight) : OptionalDouble.empty();
    }

    public int size() {
        return weights.size();
    }

    private static double clamp(Double weight) {
        if (weight == null || Double.isNaN(weight)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, weight));
    }
}
