package com.cred.freestyle.salesdata.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code salesdata.*} prefix.
 *
 * @author Sales Data Team
 */
@Data
@ConfigurationProperties(prefix = "salesdata")
public class SalesDataProperties {

    private Generator generator = new Generator();

    private Media media = new Media();

    private Customers customers = new Customers();

    @Data
    public static class Generator {

        /**
         * Length of the simulated history, ending today.
         */
        private int windowDays = 730;

        /**
         * Zone used to resolve "today" and to place simulated orders within a day.
         */
        private String zone = "UTC";

        /**
         * Optional random seed. Unset means a fresh, unseeded generator per application start.
         */
        private Long seed;

        private boolean runOnStartup = false;

        private boolean clearOnStartup = false;

        /**
         * Reuse the stored catalog as-is once it has at least this many products.
         */
        private int minExistingProducts = 30;

        /**
         * Reuse the stored buyers as-is once there are at least this many.
         */
        private int minExistingCustomers = 15;

        /**
         * Upper bound of products and customers drawn from storage for one run.
         */
        private int maxPoolSize = 30;
    }

    @Data
    public static class Media {

        private String root = "./media";

        private String placeholderPath = "products/placeholder.png";
    }

    @Data
    public static class Customers {

        private String defaultPassword = "demo123";

        private String emailDomain = "demo.com";
    }
}
