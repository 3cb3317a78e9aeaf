package com.cred.freestyle.salesdata.simulation;

import com.cred.freestyle.salesdata.domain.model.Product;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Draws the contents of one simulated order.
 *
 * - Basket size: 1..4 with weights 0.5 / 0.3 / 0.15 / 0.05
 * - Each slot: one product sampled with replacement, weighted by popularity
 * - Quantity per slot: 1..3 with weights 0.7 / 0.2 / 0.1
 *
 * Repeated products are kept as separate lines.
 *
 * @author Sales Data Team
 */
public class BasketSampler {

    static final int[] BASKET_SIZES = {1, 2, 3, 4};
    static final double[] BASKET_SIZE_WEIGHTS = {0.5, 0.3, 0.15, 0.05};

    static final int[] QUANTITIES = {1, 2, 3};
    static final double[] QUANTITY_WEIGHTS = {0.7, 0.2, 0.1};

    private final Random random;

    public BasketSampler(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Sample a basket from the catalog.
     *
     * @param catalog Products to draw from, not empty
     * @param popularity Relative weights by product ID
     * @return Basket with 1 to 4 lines
     */
    public Basket sample(List<Product> catalog, PopularityIndex popularity) {
        if (catalog == null || catalog.isEmpty()) {
            throw new IllegalArgumentException("Cannot sample a basket from an empty catalog");
        }

        int size = drawBasketSize();
        List<BasketLine> lines = new ArrayList<>(size);
        for (int slot = 0; slot < size; slot++) {
            Product product = WeightedPicker.pick(random, catalog, p -> popularity.weightOf(p.getProductId()));
            lines.add(new BasketLine(product, drawQuantity(), product.getPrice()));
        }
        return new Basket(lines);
    }

    int drawBasketSize() {
        return BASKET_SIZES[WeightedPicker.pickIndex(random, BASKET_SIZE_WEIGHTS)];
    }

    int drawQuantity() {
        return QUANTITIES[WeightedPicker.pickIndex(random, QUANTITY_WEIGHTS)];
    }
}
