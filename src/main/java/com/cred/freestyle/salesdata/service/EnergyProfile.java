package com.cred.freestyle.salesdata.service;

import java.util.Locale;
import java.util.Random;

/**
 * Plausible yearly energy consumption ranges (kWh) by appliance family.
 * The family is recognised from keywords in the category name (English and Spanish).
 *
 * @author Sales Data Team
 */
public enum EnergyProfile {

    REFRIGERATION(250, 550, "refrigerat", "fridge", "freezer", "heladera"),
    LAUNDRY(50, 200, "washing", "laundry", "dryer", "lavarropa"),
    MICROWAVE(50, 120, "microwave", "microonda"),
    TELEVISION(30, 200, "television", "televisor"),
    COOLING(500, 2000, "air condition", "cooling", "aire"),
    // gas cooktops draw no electricity, so half of them report zero
    COOKING(200, 800, "cooktop", "cooking", "stove", "cocina") {
        @Override
        public double sample(Random random) {
            return random.nextBoolean() ? 0.0 : super.sample(random);
        }
    },
    GENERIC(20, 500);

    private final int minKwh;
    private final int maxKwh;
    private final String[] keywords;

    EnergyProfile(int minKwh, int maxKwh, String... keywords) {
        this.minKwh = minKwh;
        this.maxKwh = maxKwh;
        this.keywords = keywords;
    }

    /**
     * Resolve the profile for a category name. Unknown or blank names map to GENERIC.
     *
     * @param categoryName Category name, may be null
     * @return Energy profile
     */
    public static EnergyProfile forCategory(String categoryName) {
        if (categoryName == null || categoryName.isBlank()) {
            return GENERIC;
        }
        String normalized = categoryName.toLowerCase(Locale.ROOT);
        for (EnergyProfile profile : values()) {
            for (String keyword : profile.keywords) {
                if (normalized.contains(keyword)) {
                    return profile;
                }
            }
        }
        return GENERIC;
    }

    /**
     * Uniform whole number of kWh within the range, both ends included.
     *
     * @param random Random source
     * @return Yearly consumption in kWh
     */
    public double sample(Random random) {
        return minKwh + random.nextInt(maxKwh - minKwh + 1);
    }

    public int getMinKwh() {
        return minKwh;
    }

    public int getMaxKwh() {
        return maxKwh;
    }
}
