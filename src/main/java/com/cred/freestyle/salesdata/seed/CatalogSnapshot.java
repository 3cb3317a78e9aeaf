package com.cred.freestyle.salesdata.seed;

import com.cred.freestyle.salesdata.domain.model.Product;
import com.cred.freestyle.salesdata.simulation.PopularityIndex;

import java.util.List;
import java.util.Objects;

/**
 * Products available to one generation run together with their popularity weights.
 *
 * @author Sales Data Team
 */
public final class CatalogSnapshot {

    private final List<Product> products;
    private final PopularityIndex popularity;

    public CatalogSnapshot(List<Product> products, PopularityIndex popularity) {
        this.products = List.copyOf(products);
        this.popularity = Objects.requireNonNull(popularity, "popularity");
    }

    public List<Product> getProducts() {
        return products;
    }

    public PopularityIndex getPopularity() {
        return popularity;
    }

    public int size() {
        return products.size();
    }

    public boolean isEmpty() {
        return products.isEmpty();
    }
}
