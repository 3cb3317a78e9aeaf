package com.cred.freestyle.salesdata.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Store customer. The generator only ever draws buyers (role CLIENT) from the pool
 * and never mutates a customer per order.
 *
 * @author Sales Data Team
 */
@Entity
@Table(name = "customers", indexes = {
    @Index(name = "idx_customer_username", columnList = "username", unique = true),
    @Index(name = "idx_customer_role", columnList = "role")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Customer {

    @Id
    @Column(name = "customer_id", nullable = false, length = 36)
    private String customerId;

    /**
     * Natural key for get-or-create lookups (e.g., "cliente7").
     */
    @Column(name = "username", nullable = false, unique = true, length = 150)
    private String username;

    @Column(name = "email", length = 255)
    private String email;

    @Column(name = "first_name", length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    /**
     * BCrypt hash. Null if hashing failed during seeding.
     */
    @Column(name = "password_hash", length = 100)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    @Builder.Default
    private CustomerRole role = CustomerRole.CLIENT;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (customerId == null) {
            customerId = UUID.randomUUID().toString();
        }
        if (role == null) {
            role = CustomerRole.CLIENT;
        }
        createdAt = Instant.now();
    }

    /**
     * Customer role marker.
     */
    public enum CustomerRole {
        /**
         * Buyer. Only buyers place simulated orders.
         */
        CLIENT,

        /**
         * Store staff.
         */
        STAFF
    }
}
