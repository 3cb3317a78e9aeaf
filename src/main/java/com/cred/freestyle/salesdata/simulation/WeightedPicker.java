package com.cred.freestyle.salesdata.simulation;

import java.util.List;
import java.util.Random;
import java.util.function.ToDoubleFunction;

/**
 * Weighted random selection with replacement.
 * Negative, NaN and infinite weights count as zero. If no weight is positive the
 * choice falls back to uniform selection instead of failing.
 *
 * @author Sales Data Team
 */
public final class WeightedPicker {

    private WeightedPicker() {
    }

    /**
     * Pick an index with probability proportional to its weight.
     *
     * @param random Random source
     * @param weights Relative weights, at least one element
     * @return Selected index
     */
    public static int pickIndex(Random random, double[] weights) {
        if (weights.length == 0) {
            throw new IllegalArgumentException("Cannot pick from an empty weight vector");
        }

        double total = 0.0;
        for (double weight : weights) {
            total += sanitize(weight);
        }

        if (total <= 0.0) {
            return random.nextInt(weights.length);
        }

        double target = random.nextDouble() * total;
        double cumulative = 0.0;
        int lastPositive = 0;
        for (int i = 0; i < weights.length; i++) {
            double weight = sanitize(weights[i]);
            if (weight <= 0.0) {
                continue;
            }
            cumulative += weight;
            lastPositive = i;
            if (target < cumulative) {
                return i;
            }
        }
        // floating point rounding can leave target == total
        return lastPositive;
    }

    /**
     * Pick one item with probability proportional to {@code weightOf(item)}.
     *
     * @param random Random source
     * @param items Candidates, not empty
     * @param weightOf Weight extractor
     * @return Selected item
     */
    public static <T> T pick(Random random, List<T> items, ToDoubleFunction<T> weightOf) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        double[] weights = new double[items.size()];
        for (int i = 0; i < items.size(); i++) {
            weights[i] = weightOf.applyAsDouble(items.get(i));
        }
        return items.get(pickIndex(random, weights));
    }

    private static double sanitize(double weight) {
        if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0.0) {
            return 0.0;
        }
        return weight;
    }
}
