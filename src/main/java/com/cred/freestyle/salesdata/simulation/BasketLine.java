package com.cred.freestyle.salesdata.simulation;

import com.cred.freestyle.salesdata.domain.model.Product;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One candidate line of a simulated basket: product, quantity and the unit price
 * captured when the basket was drawn.
 *
 * @author Sales Data Team
 */
public final class BasketLine {

    private final Product product;
    private final int quantity;
    private final BigDecimal unitPrice;

    public BasketLine(Product product, int quantity, BigDecimal unitPrice) {
        this.product = Objects.requireNonNull(product, "product");
        this.unitPrice = Objects.requireNonNull(unitPrice, "unitPrice");
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        this.quantity = quantity;
    }

    public Product getProduct() {
        return product;
    }

    public String getProductId() {
        return product.getProductId();
    }

    public int getQuantity() {
        return quantity;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public BigDecimal lineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    @Override
    public String toString() {
        return "BasketLine[" + product.getName() + " x" + quantity + " @ " + unitPrice + "]";
    }
}
