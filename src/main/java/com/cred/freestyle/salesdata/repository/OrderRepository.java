package com.cred.freestyle.salesdata.repository;

import com.cred.freestyle.salesdata.domain.model.Order;
import com.cred.freestyle.salesdata.domain.model.Order.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Repository interface for Order entity.
 *
 * @author Sales Data Team
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, String> {

    /**
     * Find all orders of a customer.
     *
     * @param customerId Customer ID
     * @return List of orders
     */
    List<Order> findByCustomerId(String customerId);

    /**
     * Count orders by status.
     *
     * @param status Order status
     * @return Number of orders
     */
    long countByStatus(OrderStatus status);

    /**
     * Find orders created within a time range, oldest first.
     *
     * @param startTime Start time
     * @param endTime End time
     * @return List of orders
     */
    @Query("SELECT o FROM Order o WHERE o.createdAt BETWEEN :startTime AND :endTime ORDER BY o.createdAt ASC")
    List<Order> findByCreatedAtBetween(
            @Param("startTime") Instant startTime,
            @Param("endTime") Instant endTime
    );

    /**
     * Sum of all order totals.
     *
     * @return Total revenue, zero when there are no orders
     */
    @Query("SELECT COALESCE(SUM(o.totalPrice), 0) FROM Order o")
    BigDecimal sumTotalPrice();

    /**
     * Replace the insert-time timestamps with the simulated instant.
     * Bulk update, so @PrePersist/@PreUpdate do not run.
     *
     * @param orderId Order ID
     * @param timestamp Simulated creation instant
     * @return Number of rows updated
     */
    @Transactional
    @Modifying
    @Query("UPDATE Order o SET o.createdAt = :timestamp, o.updatedAt = :timestamp WHERE o.orderId = :orderId")
    int overrideTimestamps(@Param("orderId") String orderId, @Param("timestamp") Instant timestamp);

    /**
     * Set total and status after some items of the order could not be stored.
     *
     * @param orderId Order ID
     * @param totalPrice Sum of the persisted items
     * @param status New status
     * @return Number of rows updated
     */
    @Transactional
    @Modifying
    @Query("UPDATE Order o SET o.totalPrice = :totalPrice, o.status = :status WHERE o.orderId = :orderId")
    int reconcileTotal(
            @Param("orderId") String orderId,
            @Param("totalPrice") BigDecimal totalPrice,
            @Param("status") OrderStatus status
    );
}
