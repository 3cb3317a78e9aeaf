package com.cred.freestyle.salesdata.repository;

import com.cred.freestyle.salesdata.domain.model.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for OrderItem entity.
 *
 * @author Sales Data Team
 */
@Repository
public interface OrderItemRepository extends JpaRepository<OrderItem, String> {

    /**
     * Find all items of an order.
     *
     * @param orderId Order ID
     * @return List of order items
     */
    List<OrderItem> findByOrderId(String orderId);

    /**
     * Total units sold of a product across all orders.
     *
     * @param productId Product ID
     * @return Sum of quantities, zero if never sold
     */
    @Query("SELECT COALESCE(SUM(i.quantity), 0) FROM OrderItem i WHERE i.productId = :productId")
    Long sumQuantityByProductId(@Param("productId") String productId);
}
