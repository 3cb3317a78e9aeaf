package com.cred.freestyle.salesdata.service;

import com.cred.freestyle.salesdata.domain.model.Product;
import com.cred.freestyle.salesdata.generator.IsolatedUnitOfWork;
import com.cred.freestyle.salesdata.generator.PersistOutcome;
import com.cred.freestyle.salesdata.infrastructure.metrics.GenerationMetricsService;
import com.cred.freestyle.salesdata.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Random;

/**
 * Assigns the derived product metrics (rating and yearly energy consumption) that are still missing.
 *
 * Values are only ever written where the column is NULL, through conditional updates, so a
 * metric that is already set is never replaced, whether it was set by an earlier pass, by a
 * concurrent pass or by hand. After writing, the in-memory product is refreshed from the
 * stored row, so callers always see the value that actually won.
 *
 * Failures never propagate: they are logged and reported in the {@link BackfillResult}.
 *
 * @author Sales Data Team
 */
@Service
public class ProductMetricsBackfill {

    private static final Logger logger = LoggerFactory.getLogger(ProductMetricsBackfill.class);

    static final double BASE_RATING = 3.5;
    static final double MAX_PRICE_BONUS = 1.5;
    static final double PRICE_BONUS_DIVISOR = 2000.0;
    static final double RATING_NOISE = 0.3;
    static final double MAX_RATING = 5.0;

    private final ProductRepository productRepository;
    private final IsolatedUnitOfWork unitOfWork;
    private final GenerationMetricsService metricsService;
    private final Random random;

    public ProductMetricsBackfill(
            ProductRepository productRepository,
            IsolatedUnitOfWork unitOfWork,
            GenerationMetricsService metricsService,
            Random random
    ) {
        this.productRepository = productRepository;
        this.unitOfWork = unitOfWork;
        this.metricsService = metricsService;
        this.random = random;
    }

    /**
     * Fill in whatever metrics the product is missing.
     *
     * @param product Stored product (must have an ID)
     * @param popularity Popularity weight if known; drives the rating instead of the price
     * @return What was assigned, and whether anything failed
     */
    public BackfillResult ensureMetrics(Product product, OptionalDouble popularity) {
        if (product.hasMetrics()) {
            return BackfillResult.unchanged(product.getProductId());
        }

        String productId = product.getProductId();
        boolean failed = false;
        boolean ratingAssigned = false;
        boolean energyAssigned = false;
        boolean written = false;

        if (product.getRating() == null) {
            try {
                BigDecimal rating = deriveRating(product.getPrice(), popularity);
                PersistOutcome<Integer> outcome = unitOfWork.run("product rating",
                        () -> productRepository.assignRatingIfAbsent(productId, rating));
                if (outcome.isSuccess()) {
                    written = true;
                    ratingAssigned = assigned(outcome);
                } else {
                    failed = true;
                }
            } catch (RuntimeException e) {
                logger.warn("Could not derive rating for product {}: {}", productId, e.getMessage());
                failed = true;
            }
        }

        if (product.getEnergyKwhPerYear() == null) {
            try {
                double energy = deriveEnergy(product);
                PersistOutcome<Integer> outcome = unitOfWork.run("product energy estimate",
                        () -> productRepository.assignEnergyIfAbsent(productId, energy));
                if (outcome.isSuccess()) {
                    written = true;
                    energyAssigned = assigned(outcome);
                } else {
                    failed = true;
                }
            } catch (RuntimeException e) {
                logger.warn("Could not derive energy estimate for product {}: {}", productId, e.getMessage());
                failed = true;
            }
        }

        if (written) {
            refresh(product);
        }
        if (ratingAssigned) {
            metricsService.recordMetricAssigned("rating");
        }
        if (energyAssigned) {
            metricsService.recordMetricAssigned("energy");
        }
        if (failed) {
            metricsService.recordBackfillFailure();
        }

        logger.debug("Metrics of product {}: rating assigned={}, energy assigned={}, failed={}",
                productId, ratingAssigned, energyAssigned, failed);
        return new BackfillResult(productId, ratingAssigned, energyAssigned, failed);
    }

    /**
     * Backfill over the stored catalog, oldest products first.
     *
     * @param limit Maximum number of products to check; 0 checks all of them
     * @return Checked, updated and failed counts
     * @throws IllegalArgumentException if limit is negative
     */
    public BackfillSummary backfillAll(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }

        Sort oldestFirst = Sort.by(Sort.Direction.ASC, "createdAt");
        List<Product> products = limit == 0
                ? productRepository.findAll(oldestFirst)
                : productRepository.findAll(PageRequest.of(0, limit, oldestFirst)).getContent();

        int updated = 0;
        int failed = 0;
        for (Product product : products) {
            BackfillResult result = ensureMetrics(product, OptionalDouble.empty());
            if (result.isUpdated()) {
                updated++;
            }
            if (result.isFailed()) {
                failed++;
            }
        }

        BackfillSummary summary = new BackfillSummary(products.size(), updated, failed);
        logger.info("Product metrics backfill finished: {}", summary);
        return summary;
    }

    /**
     * Rating in [0, 5], two decimals.
     * With a popularity weight p: 3.5 + (p - 0.5) * 2; otherwise 3.5 + min(1.5, price / 2000).
     * Both get uniform noise in [-0.3, 0.3].
     */
    BigDecimal deriveRating(BigDecimal price, OptionalDouble popularity) {
        double base;
        if (popularity.isPresent()) {
            base = BASE_RATING + (popularity.getAsDouble() - 0.5) * 2.0;
        } else {
            if (price == null) {
                throw new IllegalArgumentException("price is missing");
            }
            base = BASE_RATING + Math.min(MAX_PRICE_BONUS, price.doubleValue() / PRICE_BONUS_DIVISOR);
        }
        double noise = (random.nextDouble() * 2.0 - 1.0) * RATING_NOISE;
        double rating = Math.max(0.0, Math.min(MAX_RATING, base + noise));
        return BigDecimal.valueOf(rating).setScale(2, RoundingMode.HALF_UP);
    }

    double deriveEnergy(Product product) {
        return EnergyProfile.forCategory(product.getCategoryName()).sample(random);
    }

    private static boolean assigned(PersistOutcome<Integer> outcome) {
        return outcome.getValue() != null && outcome.getValue() > 0;
    }

    private void refresh(Product product) {
        PersistOutcome<Product> stored = unitOfWork.run("product refresh",
                () -> productRepository.findById(product.getProductId()).orElse(null));
        if (stored.isSuccess() && stored.getValue() != null) {
            product.setRating(stored.getValue().getRating());
            product.setEnergyKwhPerYear(stored.getValue().getEnergyKwhPerYear());
        } else {
            logger.warn("Could not reload metrics of product {}", product.getProductId());
        }
    }
}
