package com.cred.freestyle.salesdata.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Product entity representing a catalog item of the appliance store.
 *
 * Rating and yearly energy consumption are derived metrics: they are written once,
 * when absent, and never overwritten afterwards (see ProductMetricsBackfill).
 * Popularity is not stored here; it travels alongside the catalog in a PopularityIndex.
 *
 * @author Sales Data Team
 */
@Entity
@Table(name = "products", indexes = {
    @Index(name = "idx_product_name", columnList = "name", unique = true),
    @Index(name = "idx_product_category", columnList = "category_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    @Id
    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    /**
     * Display name. Natural key for get-or-create lookups.
     */
    @Column(name = "name", nullable = false, unique = true, length = 255)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    /**
     * Current unit price. Order items snapshot this value at sale time.
     */
    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    /**
     * Units on hand. Never negative; decremented by the generator and floored at zero.
     */
    @Column(name = "stock", nullable = false)
    private Integer stock;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "category_id", nullable = false)
    private Category category;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "brand_id")
    private Brand brand;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "warranty_id")
    private Warranty warranty;

    /**
     * Image path relative to the media root (e.g., "products/placeholder.png").
     */
    @Column(name = "image_url", length = 500)
    private String imageUrl;

    /**
     * Customer rating in [0, 5] with two decimals. Null until backfilled.
     */
    @Column(name = "rating", precision = 3, scale = 2)
    private BigDecimal rating;

    /**
     * Estimated yearly energy consumption in kWh. Null until backfilled.
     */
    @Column(name = "energy_kwh_per_year")
    private Double energyKwhPerYear;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (productId == null) {
            productId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (stock == null) {
            stock = 0;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * @return true once both derived metrics have been assigned
     */
    public boolean hasMetrics() {
        return rating != null && energyKwhPerYear != null;
    }

    /**
     * Category name, or an empty string when the category is missing.
     */
    public String getCategoryName() {
        return category != null && category.getName() != null ? category.getName() : "";
    }
}
