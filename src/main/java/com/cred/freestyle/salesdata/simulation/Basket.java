package com.cred.freestyle.salesdata.simulation;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * Contents of one simulated order. The same product may appear on several lines.
 *
 * @author Sales Data Team
 */
public final class Basket {

    private final List<BasketLine> lines;

    public Basket(List<BasketLine> lines) {
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("A basket needs at least one line");
        }
        this.lines = List.copyOf(lines);
    }

    public List<BasketLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public int size() {
        return lines.size();
    }

    /**
     * Exact sum of quantity x unit price over all lines.
     */
    public BigDecimal total() {
        return lines.stream()
                .map(BasketLine::lineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
