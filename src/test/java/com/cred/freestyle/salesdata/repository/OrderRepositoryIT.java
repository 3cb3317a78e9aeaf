package com.cred.freestyle.salesdata.repository;

import com.cred.freestyle.salesdata.domain.model.Order;
import com.cred.freestyle.salesdata.domain.model.Order.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for OrderRepository using Testcontainers.
 */
@DataJpaTest
@Testcontainers
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("OrderRepository Integration Tests")
class OrderRepositoryIT {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("salesdata_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private TestEntityManager entityManager;

    private Order storeOrder(String total) {
        Order order = orderRepository.saveAndFlush(Order.builder()
                .customerId("customer-1")
                .totalPrice(new BigDecimal(total))
                .status(OrderStatus.COMPLETED)
                .build());
        entityManager.clear();
        return order;
    }

    @Test
    @DisplayName("overrideTimestamps - Replaces both insert-time timestamps")
    void overrideTimestamps_ReplacesCreatedAndUpdated() {
        // Given
        Order order = storeOrder("250.00");
        Instant simulated = Instant.parse("2023-03-14T10:42:00Z");

        // When
        int updated = orderRepository.overrideTimestamps(order.getOrderId(), simulated);
        entityManager.clear();

        // Then
        Order stored = orderRepository.findById(order.getOrderId()).orElseThrow();
        assertThat(updated).isEqualTo(1);
        assertThat(stored.getCreatedAt()).isEqualTo(simulated);
        assertThat(stored.getUpdatedAt()).isEqualTo(simulated);
        assertThat(orderRepository.findByCreatedAtBetween(
                simulated.minus(1, ChronoUnit.DAYS), simulated.plus(1, ChronoUnit.DAYS))).hasSize(1);
    }

    @Test
    @DisplayName("reconcileTotal - Sets total and status in one update")
    void reconcileTotal_SetsTotalAndStatus() {
        // Given
        Order order = storeOrder("300.00");

        // When
        orderRepository.reconcileTotal(order.getOrderId(), BigDecimal.ZERO, OrderStatus.CANCELLED);
        entityManager.clear();

        // Then
        Order stored = orderRepository.findById(order.getOrderId()).orElseThrow();
        assertThat(stored.getTotalPrice()).isEqualByComparingTo("0.00");
        assertThat(stored.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(orderRepository.countByStatus(OrderStatus.CANCELLED)).isEqualTo(1);
    }

    @Test
    @DisplayName("sumTotalPrice - Zero without orders, exact sum otherwise")
    void sumTotalPrice_ExactSum() {
        assertThat(orderRepository.sumTotalPrice()).isEqualByComparingTo("0");

        storeOrder("100.10");
        storeOrder("200.25");

        assertThat(orderRepository.sumTotalPrice()).isEqualByComparingTo("300.35");
        assertThat(orderRepository.findByCustomerId("customer-1")).hasSize(2);
    }
}
