package com.cred.freestyle.salesdata.seed;

import com.cred.freestyle.salesdata.config.SalesDataProperties;
import com.cred.freestyle.salesdata.domain.model.Brand;
import com.cred.freestyle.salesdata.domain.model.Category;
import com.cred.freestyle.salesdata.domain.model.Customer;
import com.cred.freestyle.salesdata.domain.model.Customer.CustomerRole;
import com.cred.freestyle.salesdata.domain.model.Product;
import com.cred.freestyle.salesdata.domain.model.Warranty;
import com.cred.freestyle.salesdata.repository.BrandRepository;
import com.cred.freestyle.salesdata.repository.CategoryRepository;
import com.cred.freestyle.salesdata.repository.CustomerRepository;
import com.cred.freestyle.salesdata.repository.ProductRepository;
import com.cred.freestyle.salesdata.repository.WarrantyRepository;
import com.cred.freestyle.salesdata.seed.CatalogSeed.CategorySeed;
import com.cred.freestyle.salesdata.seed.CatalogSeed.CustomerSeed;
import com.cred.freestyle.salesdata.seed.CatalogSeed.ProductSeed;
import com.cred.freestyle.salesdata.seed.CatalogSeed.WarrantySeed;
import com.cred.freestyle.salesdata.service.ProductMetricsBackfill;
import com.cred.freestyle.salesdata.simulation.PopularityIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Makes sure the catalog and the buyer pool a generation run needs exist.
 *
 * Stored data is reused once there is enough of it; otherwise the demo data in
 * {@link CatalogSeed} is get-or-created by natural key (category slug, brand name,
 * warranty name, product name, username), so repeated runs never duplicate reference data.
 *
 * @author Sales Data Team
 */
@Service
public class ReferenceDataBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceDataBootstrap.class);

    static final int MIN_INITIAL_STOCK = 20;
    static final int MAX_INITIAL_STOCK = 200;

    private static final Sort OLDEST_FIRST = Sort.by(Sort.Direction.ASC, "createdAt");

    private final ProductRepository productRepository;
    private final CategoryRepository categoryRepository;
    private final BrandRepository brandRepository;
    private final WarrantyRepository warrantyRepository;
    private final CustomerRepository customerRepository;
    private final ProductMetricsBackfill metricsBackfill;
    private final PlaceholderImageStore placeholderImageStore;
    private final PasswordEncoder passwordEncoder;
    private final SalesDataProperties properties;
    private final Random random;

    public ReferenceDataBootstrap(
            ProductRepository productRepository,
            CategoryRepository categoryRepository,
            BrandRepository brandRepository,
            WarrantyRepository warrantyRepository,
            CustomerRepository customerRepository,
            ProductMetricsBackfill metricsBackfill,
            PlaceholderImageStore placeholderImageStore,
            PasswordEncoder passwordEncoder,
            SalesDataProperties properties,
            Random random
    ) {
        this.productRepository = productRepository;
        this.categoryRepository = categoryRepository;
        this.brandRepository = brandRepository;
        this.warrantyRepository = warrantyRepository;
        this.customerRepository = customerRepository;
        this.metricsBackfill = metricsBackfill;
        this.placeholderImageStore = placeholderImageStore;
        this.passwordEncoder = passwordEncoder;
        this.properties = properties;
        this.random = random;
    }

    /**
     * Products for the run with their popularity weights.
     *
     * With at least min-existing-products stored, the oldest max-pool-size products are reused;
     * otherwise the demo catalog is get-or-created. Either way, missing metrics are backfilled.
     *
     * @return Catalog snapshot, never empty unless every product write failed
     */
    public CatalogSnapshot ensureCatalog() {
        SalesDataProperties.Generator settings = properties.getGenerator();
        long existing = productRepository.count();

        if (existing >= settings.getMinExistingProducts()) {
            List<Product> products = productRepository
                    .findAll(PageRequest.of(0, settings.getMaxPoolSize(), OLDEST_FIRST))
                    .getContent();
            PopularityIndex popularity = knownPopularity(products);
            products.forEach(product -> metricsBackfill.ensureMetrics(product, popularity.find(product.getProductId())));
            logger.info("Reusing {} of {} stored products", products.size(), existing);
            return new CatalogSnapshot(products, popularity);
        }

        logger.info("Only {} products stored, seeding demo catalog", existing);
        Map<String, Category> categories = ensureCategories();
        List<Brand> brands = ensureBrands();
        List<Warranty> warranties = ensureWarranties();
        boolean placeholderReady = placeholderImageStore.ensurePlaceholder();

        List<Product> products = new ArrayList<>();
        Map<String, Double> weights = new HashMap<>();
        for (int i = 0; i < CatalogSeed.PRODUCTS.size(); i++) {
            ProductSeed seed = CatalogSeed.PRODUCTS.get(i);
            Brand brand = brands.isEmpty() ? null : brands.get(i % brands.size());
            Warranty warranty = warranties.isEmpty() ? null : warranties.get(i % warranties.size());

            Product product = ensureProduct(seed, categories.get(seed.getCategorySlug()), brand, warranty);
            if (product == null) {
                continue;
            }
            if (product.getImageUrl() == null && placeholderReady) {
                product = attachPlaceholder(product);
            }
            metricsBackfill.ensureMetrics(product, OptionalDouble.of(seed.getPopularity()));
            weights.put(product.getProductId(), seed.getPopularity());
            products.add(product);
        }

        logger.info("Demo catalog ready: {} products", products.size());
        return new CatalogSnapshot(products, PopularityIndex.of(weights));
    }

    /**
     * Buyers for the run.
     *
     * With at least min-existing-customers buyers stored, up to max-pool-size of them are reused;
     * otherwise the demo buyers are get-or-created.
     *
     * @return Buyer pool
     */
    public List<Customer> ensureCustomers() {
        SalesDataProperties.Generator settings = properties.getGenerator();
        long existing = customerRepository.countByRole(CustomerRole.CLIENT);

        if (existing >= settings.getMinExistingCustomers()) {
            List<Customer> customers = customerRepository.findByRole(
                    CustomerRole.CLIENT, PageRequest.of(0, settings.getMaxPoolSize(), OLDEST_FIRST));
            logger.info("Reusing {} of {} stored buyers", customers.size(), existing);
            return customers;
        }

        logger.info("Only {} buyers stored, seeding demo customers", existing);
        List<Customer> customers = new ArrayList<>();
        for (int i = 0; i < CatalogSeed.CUSTOMERS.size(); i++) {
            customers.add(ensureCustomer(CatalogSeed.username(i + 1), CatalogSeed.CUSTOMERS.get(i)));
        }
        return customers;
    }

    private Map<String, Category> ensureCategories() {
        Map<String, Category> categories = new LinkedHashMap<>();
        for (CategorySeed seed : CatalogSeed.CATEGORIES) {
            Category category = getOrCreate(
                    () -> categoryRepository.findBySlug(seed.getSlug()).orElse(null),
                    () -> categoryRepository.save(Category.builder()
                            .name(seed.getName())
                            .slug(seed.getSlug())
                            .build()));
            categories.put(seed.getSlug(), category);
        }
        return categories;
    }

    private List<Brand> ensureBrands() {
        List<Brand> brands = new ArrayList<>();
        for (String name : CatalogSeed.BRANDS) {
            brands.add(getOrCreate(
                    () -> brandRepository.findByName(name).orElse(null),
                    () -> brandRepository.save(Brand.builder().name(name).build())));
        }
        return brands;
    }

    private List<Warranty> ensureWarranties() {
        List<Warranty> warranties = new ArrayList<>();
        for (WarrantySeed seed : CatalogSeed.WARRANTIES) {
            warranties.add(getOrCreate(
                    () -> warrantyRepository.findByName(seed.getName()).orElse(null),
                    () -> warrantyRepository.save(Warranty.builder()
                            .name(seed.getName())
                            .durationDays(seed.getDurationDays())
                            .build())));
        }
        return warranties;
    }

    private Product ensureProduct(ProductSeed seed, Category category, Brand brand, Warranty warranty) {
        try {
            return getOrCreate(
                    () -> productRepository.findByName(seed.getName()).orElse(null),
                    () -> productRepository.save(Product.builder()
                            .name(seed.getName())
                            .description("Demo product: " + seed.getName())
                            .price(seed.getPrice())
                            .stock(MIN_INITIAL_STOCK + random.nextInt(MAX_INITIAL_STOCK - MIN_INITIAL_STOCK + 1))
                            .category(category)
                            .brand(brand)
                            .warranty(warranty)
                            .build()));
        } catch (RuntimeException e) {
            logger.error("Could not create demo product '{}'", seed.getName(), e);
            return null;
        }
    }

    private Product attachPlaceholder(Product product) {
        product.setImageUrl(placeholderImageStore.getRelativePath());
        try {
            return productRepository.save(product);
        } catch (RuntimeException e) {
            logger.warn("Could not attach placeholder image to '{}', keeping it without one: {}",
                    product.getName(), e.getMessage());
            product.setImageUrl(null);
            return product;
        }
    }

    private Customer ensureCustomer(String username, CustomerSeed seed) {
        return getOrCreate(
                () -> customerRepository.findByUsername(username).orElse(null),
                () -> customerRepository.save(Customer.builder()
                        .username(username)
                        .email(username + "@" + properties.getCustomers().getEmailDomain())
                        .firstName(seed.getFirstName())
                        .lastName(seed.getLastName())
                        .passwordHash(hashDefaultPassword(username))
                        .role(CustomerRole.CLIENT)
                        .build()));
    }

    private String hashDefaultPassword(String username) {
        try {
            return passwordEncoder.encode(properties.getCustomers().getDefaultPassword());
        } catch (RuntimeException e) {
            logger.warn("Could not hash password of {}, storing the buyer without one: {}", username, e.getMessage());
            return null;
        }
    }

    /**
     * Look up by natural key, create if missing. A unique-key race with another writer
     * is resolved by reading the row that won.
     */
    private static <T> T getOrCreate(Supplier<T> lookup, Supplier<T> create) {
        T existing = lookup.get();
        if (existing != null) {
            return existing;
        }
        try {
            return create.get();
        } catch (DataIntegrityViolationException e) {
            T winner = lookup.get();
            if (winner == null) {
                throw e;
            }
            return winner;
        }
    }

    private static PopularityIndex knownPopularity(List<Product> products) {
        Map<String, Double> seeded = new HashMap<>();
        CatalogSeed.PRODUCTS.forEach(seed -> seeded.put(seed.getName(), seed.getPopularity()));

        Map<String, Double> weights = new HashMap<>();
        for (Product product : products) {
            Double weight = seeded.get(product.getName());
            if (weight != null) {
                weights.put(product.getProductId(), weight);
            }
        }
        return PopularityIndex.of(weights);
    }
}
