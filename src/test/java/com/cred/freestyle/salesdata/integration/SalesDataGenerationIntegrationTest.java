package com.cred.freestyle.salesdata.integration;

import com.cred.freestyle.salesdata.domain.model.Customer;
import com.cred.freestyle.salesdata.domain.model.Order;
import com.cred.freestyle.salesdata.domain.model.Order.OrderStatus;
import com.cred.freestyle.salesdata.domain.model.OrderItem;
import com.cred.freestyle.salesdata.domain.model.Product;
import com.cred.freestyle.salesdata.generator.GenerationStats;
import com.cred.freestyle.salesdata.generator.SalesHistoryWriter;
import com.cred.freestyle.salesdata.repository.CustomerRepository;
import com.cred.freestyle.salesdata.repository.OrderItemRepository;
import com.cred.freestyle.salesdata.repository.OrderRepository;
import com.cred.freestyle.salesdata.repository.ProductRepository;
import com.cred.freestyle.salesdata.seed.CatalogSnapshot;
import com.cred.freestyle.salesdata.seed.ReferenceDataBootstrap;
import com.cred.freestyle.salesdata.service.BackfillSummary;
import com.cred.freestyle.salesdata.service.GenerationSummary;
import com.cred.freestyle.salesdata.service.SalesDataGenerationService;
import com.cred.freestyle.salesdata.simulation.DemandCurveModel;
import com.cred.freestyle.salesdata.simulation.PopularityIndex;
import com.cred.freestyle.salesdata.simulation.SimulationWindow;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end generation runs against an in-memory database.
 * Uses a 60-day window to keep the runs short.
 */
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:salesdatadb;DB_CLOSE_DELAY=-1",
    "spring.datasource.driver-class-name=org.h2.Driver",
    "spring.datasource.username=sa",
    "spring.datasource.password=",
    "spring.jpa.hibernate.ddl-auto=create-drop",
    "spring.jpa.show-sql=false",
    "salesdata.generator.window-days=60",
    "salesdata.generator.seed=42",
    "salesdata.media.root=${java.io.tmpdir}/salesdata-media-test",
    "logging.level.com.cred.freestyle.salesdata.generator=ERROR"
})
@AutoConfigureMockMvc
@DisplayName("Sales Data Generation Integration Tests")
class SalesDataGenerationIntegrationTest {

    private static final int WINDOW_DAYS = 60;

    @Autowired
    private SalesDataGenerationService generationService;

    @Autowired
    private SalesHistoryWriter historyWriter;

    @Autowired
    private ReferenceDataBootstrap bootstrap;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private OrderItemRepository orderItemRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        historyWriter.clearHistory();
    }

    private void assertEveryOrderMatchesItsLines() {
        for (Order order : orderRepository.findAll()) {
            List<OrderItem> items = orderItemRepository.findByOrderId(order.getOrderId());
            BigDecimal linesTotal = items.stream()
                    .map(OrderItem::getLineTotal)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);

            assertThat(order.getTotalPrice())
                    .as("total of order %s", order.getOrderId())
                    .isEqualByComparingTo(linesTotal);
            if (items.isEmpty()) {
                assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            }
        }
    }

    private double counterValue(String name, String... tags) {
        Counter counter = meterRegistry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0.0;
    }

    // ========================================
    // Full run
    // ========================================

    @Test
    @DisplayName("Full run - Seeds the catalog and buyers, writes consistent history for every day")
    void generate_EmptyDatabase_ProducesConsistentHistory() {
        // When
        GenerationSummary summary = generationService.generate(false);

        // Then
        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        assertThat(summary.getEndDate()).isEqualTo(today);
        assertThat(summary.getStartDate()).isEqualTo(today.minusDays(WINDOW_DAYS));
        assertThat(summary.getProductsCount()).isGreaterThanOrEqualTo(15);
        assertThat(summary.getCustomersCount()).isGreaterThanOrEqualTo(15);
        assertThat(summary.getTotalOrders()).isGreaterThanOrEqualTo(WINDOW_DAYS + 1);
        assertThat(summary.getTotalRevenue()).isPositive();
        assertThat(summary.getHeaderFailures()).isZero();
        assertThat(summary.getLineFailures()).isZero();

        assertThat(orderRepository.count()).isEqualTo(summary.getTotalOrders());
        assertThat(orderRepository.sumTotalPrice()).isEqualByComparingTo(summary.getTotalRevenue());
        assertThat(orderRepository.countByStatus(OrderStatus.COMPLETED)).isEqualTo(summary.getTotalOrders());
        assertThat(customerRepository.findByUsername("cliente1")).isPresent();
        assertThat(productRepository.findByCategorySlug("refrigerators")).hasSize(2);
        assertThat(productRepository.findMissingMetrics()).isEmpty();
        assertEveryOrderMatchesItsLines();
    }

    @Test
    @DisplayName("Full run - Orders are placed between 08:00 and 20:59 on days inside the window")
    void generate_TimestampsInsideWindowAndBusinessHours() {
        // When
        GenerationSummary summary = generationService.generate(false);

        // Then
        List<Order> inWindow = orderRepository.findByCreatedAtBetween(
                summary.getStartDate().atStartOfDay(ZoneOffset.UTC).toInstant(),
                summary.getEndDate().plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant());
        assertThat(inWindow).hasSize((int) summary.getTotalOrders());

        for (Order order : inWindow) {
            ZonedDateTime placedAt = order.getCreatedAt().atZone(ZoneOffset.UTC);
            assertThat(placedAt.getHour()).isBetween(8, 20);
            assertThat(order.getUpdatedAt()).isEqualTo(order.getCreatedAt());
        }
    }

    @Test
    @DisplayName("Full run - Stock ends at max(0, initial - units sold) for every product")
    void generate_StockDecrementedAndFlooredAtZero() {
        // Given
        CatalogSnapshot catalog = bootstrap.ensureCatalog();
        Map<String, Integer> initialStock = new HashMap<>();
        for (Product product : catalog.getProducts()) {
            initialStock.put(product.getProductId(), productRepository.getStock(product.getProductId()));
        }

        // When
        generationService.generate(false);

        // Then
        for (Map.Entry<String, Integer> entry : initialStock.entrySet()) {
            long sold = orderItemRepository.sumQuantityByProductId(entry.getKey());
            int expected = (int) Math.max(0L, entry.getValue() - sold);
            assertThat(productRepository.getStock(entry.getKey()))
                    .as("stock of %s", entry.getKey())
                    .isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("Append vs clear - Append adds to the history; clear leaves only the new run")
    void generate_AppendThenClear() {
        // Given
        GenerationSummary first = generationService.generate(false);

        // When: append
        GenerationSummary second = generationService.generate(false);

        // Then
        assertThat(orderRepository.count()).isEqualTo(first.getTotalOrders() + second.getTotalOrders());

        // When: clear
        GenerationSummary third = generationService.generate(true);

        // Then
        assertThat(third.getOrdersCleared()).isEqualTo(first.getTotalOrders() + second.getTotalOrders());
        assertThat(orderRepository.count()).isEqualTo(third.getTotalOrders());
        assertThat(customerRepository.count()).isEqualTo(16);
        assertThat(productRepository.count()).isEqualTo(15);
    }

    // ========================================
    // Fault isolation
    // ========================================

    @Test
    @DisplayName("Fault isolation - Lines for an unstorable product are skipped, the rest of the run completes")
    void write_UnstorableProduct_SkippedAndReconciled() {
        // Given: a product that was never stored and whose ID does not fit the item column
        Product real = bootstrap.ensureCatalog().getProducts().get(0);
        Product ghost = Product.builder()
                .productId("ghost-product-with-an-identifier-too-long-to-store")
                .name("Ghost Appliance")
                .price(new BigDecimal("99.00"))
                .stock(10)
                .category(real.getCategory())
                .build();
        Map<String, Double> weights = new HashMap<>();
        weights.put(real.getProductId(), 0.5);
        weights.put(ghost.getProductId(), 1.0);
        CatalogSnapshot catalog = new CatalogSnapshot(List.of(real, ghost), PopularityIndex.of(weights));
        List<Customer> customers = bootstrap.ensureCustomers();

        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        DemandCurveModel demandCurve = new DemandCurveModel(
                new SimulationWindow(today.minusDays(9), today), new Random(7));
        double failuresBefore = counterValue("salesdata.generator.failures", "stage", "order_item");

        // When
        GenerationStats stats = historyWriter.write(demandCurve, catalog, customers);

        // Then
        assertThat(stats.getDaysSimulated()).isEqualTo(10);
        assertThat(stats.getHeaderFailures()).isZero();
        assertThat(stats.getLineFailures()).isPositive();
        assertThat(stats.getReconciledOrders()).isPositive();
        assertThat(stats.getStockUpdateFailures()).isZero();
        assertThat(orderRepository.count()).isEqualTo(stats.getOrdersPersisted());
        assertThat(orderRepository.countByStatus(OrderStatus.CANCELLED)).isEqualTo(stats.getEmptyOrders());
        assertThat(orderItemRepository.sumQuantityByProductId(ghost.getProductId())).isZero();
        assertThat(orderRepository.sumTotalPrice()).isEqualByComparingTo(stats.getTotalRevenue());
        assertThat(counterValue("salesdata.generator.failures", "stage", "order_item") - failuresBefore)
                .isEqualTo((double) stats.getLineFailures());
        assertEveryOrderMatchesItsLines();
    }

    // ========================================
    // Product metrics backfill
    // ========================================

    @Test
    @DisplayName("Backfill - Only products missing a metric are updated, and only once")
    void updateProductMetrics_Idempotent() {
        // Given
        bootstrap.ensureCatalog();
        Product product = productRepository.findByName("Robot Vacuum").orElseThrow();
        product.setRating(null);
        productRepository.save(product);
        assertThat(productRepository.findMissingMetrics()).hasSize(1);

        // When
        BackfillSummary first = generationService.updateProductMetrics(0);
        BackfillSummary second = generationService.updateProductMetrics(0);

        // Then
        assertThat(first.getProductsChecked()).isEqualTo(15);
        assertThat(first.getProductsUpdated()).isEqualTo(1);
        assertThat(second.getProductsUpdated()).isZero();
        assertThat(productRepository.findMissingMetrics()).isEmpty();
        assertThat(productRepository.findByName("Robot Vacuum").orElseThrow().getRating())
                .isBetween(BigDecimal.ZERO, new BigDecimal("5.00"));
    }

    @Test
    @DisplayName("Backfill over HTTP - Admin call reports checked and updated products")
    void backfillEndpoint_Admin_ReturnsCounts() throws Exception {
        // Given
        bootstrap.ensureCatalog();

        // When / Then
        mockMvc.perform(post("/api/v1/admin/sales-data/product-metrics/backfill")
                        .param("limit", "5")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.productsChecked").value(5))
                .andExpect(jsonPath("$.productsUpdated").value(0));
    }
}
