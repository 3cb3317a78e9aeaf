package com.cred.freestyle.salesdata.repository;

import com.cred.freestyle.salesdata.domain.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Product entity.
 * Stock and metric writes are conditional bulk updates so they never read-modify-write
 * a stale entity.
 *
 * @author Sales Data Team
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, String> {

    /**
     * Find product by its display name (natural key).
     *
     * @param name Product name
     * @return Optional containing the product if found
     */
    Optional<Product> findByName(String name);

    /**
     * Find all products of a category.
     *
     * @param slug Category slug
     * @return List of products
     */
    @Query("SELECT p FROM Product p WHERE p.category.slug = :slug")
    List<Product> findByCategorySlug(@Param("slug") String slug);

    /**
     * Find products that still miss at least one derived metric.
     *
     * @return List of products without rating or energy estimate
     */
    @Query("SELECT p FROM Product p WHERE p.rating IS NULL OR p.energyKwhPerYear IS NULL")
    List<Product> findMissingMetrics();

    /**
     * Atomically decrement stock, flooring at zero.
     *
     * @param productId Product ID
     * @param quantity Units sold
     * @param now Update timestamp
     * @return Number of rows updated (0 if product does not exist)
     */
    @Transactional
    @Modifying
    @Query("UPDATE Product p SET " +
           "p.stock = CASE WHEN p.stock > :quantity THEN p.stock - :quantity ELSE 0 END, " +
           "p.updatedAt = :now " +
           "WHERE p.productId = :productId")
    int decrementStock(
            @Param("productId") String productId,
            @Param("quantity") Integer quantity,
            @Param("now") Instant now
    );

    /**
     * Assign rating only if the product has none yet.
     *
     * @param productId Product ID
     * @param rating Derived rating
     * @return 1 if assigned, 0 if a rating was already present
     */
    @Transactional
    @Modifying
    @Query("UPDATE Product p SET p.rating = :rating WHERE p.productId = :productId AND p.rating IS NULL")
    int assignRatingIfAbsent(@Param("productId") String productId, @Param("rating") BigDecimal rating);

    /**
     * Assign energy estimate only if the product has none yet.
     *
     * @param productId Product ID
     * @param energyKwhPerYear Derived yearly consumption
     * @return 1 if assigned, 0 if an estimate was already present
     */
    @Transactional
    @Modifying
    @Query("UPDATE Product p SET p.energyKwhPerYear = :energy " +
           "WHERE p.productId = :productId AND p.energyKwhPerYear IS NULL")
    int assignEnergyIfAbsent(@Param("productId") String productId, @Param("energy") Double energyKwhPerYear);

    /**
     * Lightweight stock lookup.
     *
     * @param productId Product ID
     * @return Current stock, or null if not found
     */
    @Query("SELECT p.stock FROM Product p WHERE p.productId = :productId")
    Integer getStock(@Param("productId") String productId);
}
