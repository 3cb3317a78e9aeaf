package com.cred.freestyle.salesdata.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Warranty plan that can be attached to a product.
 *
 * @author Sales Data Team
 */
@Entity
@Table(name = "warranties")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Warranty {

    @Id
    @Column(name = "warranty_id", nullable = false, length = 36)
    private String warrantyId;

    @Column(name = "name", nullable = false, unique = true, length = 150)
    private String name;

    /**
     * Coverage length in days (365 = standard, 730 = extended).
     */
    @Column(name = "duration_days", nullable = false)
    private Integer durationDays;

    @PrePersist
    protected void onCreate() {
        if (warrantyId == null) {
            warrantyId = UUID.randomUUID().toString();
        }
    }
}
