package com.cred.freestyle.salesdata.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Manufacturer brand. Name is unique.
 *
 * @author Sales Data Team
 */
@Entity
@Table(name = "brands")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Brand {

    @Id
    @Column(name = "brand_id", nullable = false, length = 36)
    private String brandId;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @PrePersist
    protected void onCreate() {
        if (brandId == null) {
            brandId = UUID.randomUUID().toString();
        }
    }
}
