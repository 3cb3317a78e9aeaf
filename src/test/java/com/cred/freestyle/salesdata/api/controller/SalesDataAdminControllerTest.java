package com.cred.freestyle.salesdata.api.controller;

import com.cred.freestyle.salesdata.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.salesdata.config.SecurityConfig;
import com.cred.freestyle.salesdata.exception.GenerationInProgressException;
import com.cred.freestyle.salesdata.exception.HistoryClearException;
import com.cred.freestyle.salesdata.generator.GenerationStats;
import com.cred.freestyle.salesdata.service.BackfillSummary;
import com.cred.freestyle.salesdata.service.GenerationSummary;
import com.cred.freestyle.salesdata.service.SalesDataGenerationService;
import com.cred.freestyle.salesdata.simulation.SimulationWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for SalesDataAdminController using MockMvc, with the real security chain.
 */
@WebMvcTest(SalesDataAdminController.class)
@ContextConfiguration(classes = {SalesDataAdminController.class, GlobalExceptionHandler.class, SecurityConfig.class})
@DisplayName("SalesDataAdminController Tests")
class SalesDataAdminControllerTest {

    private static final String GENERATE_URL = "/api/v1/admin/sales-data/generate";
    private static final String BACKFILL_URL = "/api/v1/admin/sales-data/product-metrics/backfill";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SalesDataGenerationService generationService;

    private GenerationSummary summary(long orders, String revenue, long cleared) {
        GenerationStats stats = mock(GenerationStats.class);
        when(stats.getOrdersPersisted()).thenReturn(orders);
        when(stats.getTotalRevenue()).thenReturn(new BigDecimal(revenue));
        when(stats.getLineItemsPersisted()).thenReturn(orders * 2);
        when(stats.getLineFailures()).thenReturn(3L);
        SimulationWindow window = new SimulationWindow(LocalDate.of(2022, 6, 30), LocalDate.of(2024, 6, 30));
        return GenerationSummary.of(window, stats, 15, 16, cleared);
    }

    // ========================================
    // POST /generate Tests
    // ========================================

    @Test
    @DisplayName("POST /generate - Admin gets the run summary")
    void generate_Admin_Returns200WithSummary() throws Exception {
        // Given
        GenerationSummary summary = summary(8123L, "4567890.12", 0L);
        when(generationService.generate(false)).thenReturn(summary);

        // When / Then
        mockMvc.perform(post(GENERATE_URL)
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalOrders").value(8123))
                .andExpect(jsonPath("$.totalRevenue").value(4567890.12))
                .andExpect(jsonPath("$.startDate").value("2022-06-30"))
                .andExpect(jsonPath("$.endDate").value("2024-06-30"))
                .andExpect(jsonPath("$.productsCount").value(15))
                .andExpect(jsonPath("$.customersCount").value(16))
                .andExpect(jsonPath("$.lineItems").value(16246))
                .andExpect(jsonPath("$.lineFailures").value(3));

        verify(generationService).generate(false);
    }

    @Test
    @DisplayName("POST /generate?clearExisting=true - Flag is passed through")
    void generate_ClearExisting_PassesFlag() throws Exception {
        // Given
        GenerationSummary summary = summary(10L, "100.00", 250L);
        when(generationService.generate(true)).thenReturn(summary);

        // When / Then
        mockMvc.perform(post(GENERATE_URL)
                        .param("clearExisting", "true")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalOrders").value(10));

        verify(generationService).generate(true);
    }

    @Test
    @DisplayName("POST /generate - Non-admin caller gets 403")
    void generate_UserRole_Returns403() throws Exception {
        mockMvc.perform(post(GENERATE_URL)
                        .header("X-User-Id", "user-1")
                        .header("X-User-Role", "USER"))
                .andExpect(status().isForbidden());

        verify(generationService, never()).generate(anyBoolean());
    }

    @Test
    @DisplayName("POST /generate - Anonymous caller gets 403")
    void generate_NoHeaders_Returns403() throws Exception {
        mockMvc.perform(post(GENERATE_URL))
                .andExpect(status().isForbidden());

        verifyNoInteractions(generationService);
    }

    @Test
    @DisplayName("POST /generate - Run already in progress returns 409")
    void generate_InProgress_Returns409() throws Exception {
        // Given
        when(generationService.generate(anyBoolean())).thenThrow(new GenerationInProgressException());

        // When / Then
        mockMvc.perform(post(GENERATE_URL)
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409))
                .andExpect(jsonPath("$.message").value("A sales data generation run is already in progress"))
                .andExpect(jsonPath("$.path").value(GENERATE_URL));
    }

    @Test
    @DisplayName("POST /generate - Clear failure returns 500 with a specific error")
    void generate_ClearFails_Returns500() throws Exception {
        // Given
        when(generationService.generate(true)).thenThrow(
                new HistoryClearException("Could not clear existing order history", new RuntimeException("lock timeout")));

        // When / Then
        mockMvc.perform(post(GENERATE_URL)
                        .param("clearExisting", "true")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("History Clear Failed"))
                .andExpect(jsonPath("$.message").value("Could not clear existing order history"));
    }

    @Test
    @DisplayName("POST /generate - Non-boolean flag returns 400")
    void generate_InvalidFlag_Returns400() throws Exception {
        mockMvc.perform(post(GENERATE_URL)
                        .param("clearExisting", "sometimes")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(generationService);
    }

    // ========================================
    // POST /product-metrics/backfill Tests
    // ========================================

    @Test
    @DisplayName("POST /product-metrics/backfill - Default limit checks all products")
    void backfill_DefaultLimit_Returns200() throws Exception {
        // Given
        when(generationService.updateProductMetrics(0)).thenReturn(new BackfillSummary(40, 12, 0));

        // When / Then
        mockMvc.perform(post(BACKFILL_URL)
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.productsChecked").value(40))
                .andExpect(jsonPath("$.productsUpdated").value(12));

        verify(generationService).updateProductMetrics(0);
    }

    @Test
    @DisplayName("POST /product-metrics/backfill - Negative limit returns 400")
    void backfill_NegativeLimit_Returns400() throws Exception {
        mockMvc.perform(post(BACKFILL_URL)
                        .param("limit", "-1")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        verify(generationService, never()).updateProductMetrics(anyInt());
    }

    @Test
    @DisplayName("POST /product-metrics/backfill - Non-admin caller gets 403")
    void backfill_UserRole_Returns403() throws Exception {
        mockMvc.perform(post(BACKFILL_URL)
                        .header("X-User-Id", "user-1")
                        .header("X-User-Role", "USER"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(generationService);
    }
}
