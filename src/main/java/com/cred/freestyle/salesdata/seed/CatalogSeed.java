package com.cred.freestyle.salesdata.seed;

import java.math.BigDecimal;
import java.util.List;

/**
 * Demo reference data for the appliance store: categories, brands, warranties,
 * products with their popularity, and buyers.
 *
 * @author Sales Data Team
 */
public final class CatalogSeed {

    public static final List<CategorySeed> CATEGORIES = List.of(
            new CategorySeed("Refrigerators", "refrigerators"),
            new CategorySeed("Washing Machines", "washing-machines"),
            new CategorySeed("Microwaves", "microwaves"),
            new CategorySeed("Televisions", "televisions"),
            new CategorySeed("Cooktops", "cooktops"),
            new CategorySeed("Air Conditioners", "air-conditioners"),
            new CategorySeed("Small Appliances", "small-appliances")
    );

    public static final List<String> BRANDS = List.of("Generic", "HomeTech", "ElectroMax", "SmartGoods");

    public static final List<WarrantySeed> WARRANTIES = List.of(
            new WarrantySeed("Standard Warranty 1 Year", 365),
            new WarrantySeed("Extended Warranty 2 Years", 730)
    );

    public static final List<ProductSeed> PRODUCTS = List.of(
            new ProductSeed("No Frost Refrigerator 320L", "1500.00", "refrigerators", 0.95),
            new ProductSeed("Top Mount Refrigerator 260L", "900.00", "refrigerators", 0.8),
            new ProductSeed("Front Load Washing Machine 8kg", "1100.00", "washing-machines", 0.9),
            new ProductSeed("Top Load Washing Machine 7kg", "750.00", "washing-machines", 0.7),
            new ProductSeed("Microwave 700W", "180.00", "microwaves", 0.85),
            new ProductSeed("Convection Microwave 1000W", "320.00", "microwaves", 0.6),
            new ProductSeed("Smart TV 50\" 4K", "800.00", "televisions", 0.9),
            new ProductSeed("Smart TV 32\" HD", "300.00", "televisions", 0.7),
            new ProductSeed("Gas Cooktop 4 Burners", "650.00", "cooktops", 0.6),
            new ProductSeed("Electric Cooktop 2 Plates", "220.00", "cooktops", 0.5),
            new ProductSeed("Split Air Conditioner 3000 Frig", "1200.00", "air-conditioners", 0.8),
            new ProductSeed("Portable Air Conditioner 2000 Frig", "420.00", "air-conditioners", 0.5),
            new ProductSeed("Professional Blender", "120.00", "small-appliances", 0.7),
            new ProductSeed("Vertical Steam Iron", "90.00", "small-appliances", 0.4),
            new ProductSeed("Robot Vacuum", "450.00", "small-appliances", 0.6)
    );

    /**
     * Buyers in creation order; usernames are "cliente" plus the 1-based position.
     */
    public static final List<CustomerSeed> CUSTOMERS = List.of(
            new CustomerSeed("Juan", "Pérez"), new CustomerSeed("María", "García"),
            new CustomerSeed("Carlos", "López"), new CustomerSeed("Ana", "Martínez"),
            new CustomerSeed("Luis", "Rodríguez"), new CustomerSeed("Sofía", "Fernández"),
            new CustomerSeed("Mateo", "Gómez"), new CustomerSeed("Valentina", "Díaz"),
            new CustomerSeed("Lucas", "Torres"), new CustomerSeed("Camila", "Ruiz"),
            new CustomerSeed("Diego", "Alvarez"), new CustomerSeed("Mía", "Sánchez"),
            new CustomerSeed("Martín", "Romero"), new CustomerSeed("Lucía", "Ramírez"),
            new CustomerSeed("Tomás", "Vega"), new CustomerSeed("Isabella", "Rossi")
    );

    public static final String USERNAME_PREFIX = "cliente";

    private CatalogSeed() {
    }

    public static String username(int position) {
        return USERNAME_PREFIX + position;
    }

    public static final class CategorySeed {
        private final String name;
        private final String slug;

        CategorySeed(String name, String slug) {
            this.name = name;
            this.slug = slug;
        }

        public String getName() {
            return name;
        }

        public String getSlug() {
            return slug;
        }
    }

    public static final class WarrantySeed {
        private final String name;
        private final int durationDays;

        WarrantySeed(String name, int durationDays) {
            this.name = name;
            this.durationDays = durationDays;
        }

        public String getName() {
            return name;
        }

        public int getDurationDays() {
            return durationDays;
        }
    }

    public static final class ProductSeed {
        private final String name;
        private final BigDecimal price;
        private final String categorySlug;
        private final double popularity;

        ProductSeed(String name, String price, String categorySlug, double popularity) {
            this.name = name;
            this.price = new BigDecimal(price);
            this.categorySlug = categorySlug;
            this.popularity = popularity;
        }

        public String getName() {
            return name;
        }

        public BigDecimal getPrice() {
            return price;
        }

        public String getCategorySlug() {
            return categorySlug;
        }

        public double getPopularity() {
            return popularity;
        }
    }

    public static final class CustomerSeed {
        private final String firstName;
        private final String lastName;

        CustomerSeed(String firstName, String lastName) {
            this.firstName = firstName;
            this.lastName = lastName;
        }

        public String getFirstName() {
            return firstName;
        }

        public String getLastName() {
            return lastName;
        }
    }
}
