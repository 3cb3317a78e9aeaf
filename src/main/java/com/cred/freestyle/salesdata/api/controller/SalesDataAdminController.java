package com.cred.freestyle.salesdata.api.controller;

import com.cred.freestyle.salesdata.api.dto.BackfillResponse;
import com.cred.freestyle.salesdata.api.dto.GenerationResponse;
import com.cred.freestyle.salesdata.service.BackfillSummary;
import com.cred.freestyle.salesdata.service.GenerationSummary;
import com.cred.freestyle.salesdata.service.SalesDataGenerationService;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Admin REST controller for the sales data generator.
 * Both operations are synchronous and can take a while on a large window.
 *
 * Authorization: ADMIN role only
 *
 * @author Sales Data Team
 */
@RestController
@RequestMapping("/api/v1/admin/sales-data")
@Validated
public class SalesDataAdminController {

    private static final Logger logger = LoggerFactory.getLogger(SalesDataAdminController.class);

    private final SalesDataGenerationService generationService;

    public SalesDataAdminController(SalesDataGenerationService generationService) {
        this.generationService = generationService;
    }

    /**
     * Generate simulated sales history for the trailing window.
     *
     * @param clearExisting Remove existing orders before generating
     * @return Run summary
     */
    @PostMapping("/generate")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<GenerationResponse> generate(
            @RequestParam(defaultValue = "false") boolean clearExisting
    ) {
        logger.info("Admin requested sales data generation, clearExisting: {}", clearExisting);

        GenerationSummary summary = generationService.generate(clearExisting);

        return ResponseEntity.ok(GenerationResponse.fromSummary(summary));
    }

    /**
     * Assign missing product metrics (rating, yearly energy consumption).
     *
     * @param limit Maximum number of products to check; 0 for all
     * @return Checked and updated counts
     */
    @PostMapping("/product-metrics/backfill")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<BackfillResponse> backfillProductMetrics(
            @RequestParam(defaultValue = "0") @Min(0) int limit
    ) {
        logger.info("Admin requested product metrics backfill, limit: {}", limit);

        BackfillSummary summary = generationService.updateProductMetrics(limit);

        return ResponseEntity.ok(BackfillResponse.fromSummary(summary));
    }
}
