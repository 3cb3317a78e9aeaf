package com.cred.freestyle.salesdata.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Product category (e.g., "Refrigerators", "Air Conditioners").
 * The slug is the natural key used by the seeding get-or-create lookups.
 *
 * @author Sales Data Team
 */
@Entity
@Table(name = "categories", indexes = {
    @Index(name = "idx_category_slug", columnList = "slug", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Category {

    @Id
    @Column(name = "category_id", nullable = false, length = 36)
    private String categoryId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    /**
     * URL-safe unique identifier (e.g., "air-conditioners").
     */
    @Column(name = "slug", nullable = false, unique = true, length = 100)
    private String slug;

    @PrePersist
    protected void onCreate() {
        if (categoryId == null) {
            categoryId = UUID.randomUUID().toString();
        }
    }
}
