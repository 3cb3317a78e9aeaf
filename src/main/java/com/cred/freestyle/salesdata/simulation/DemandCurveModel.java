package com.cred.freestyle.salesdata.simulation;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Random;

/**
 * Maps a calendar day to a relative demand intensity and a daily order count.
 *
 * intensity = seasonal x trend x weekday x noise
 *
 * - Seasonal: December peak (1.5), post-holiday slump in January/February (0.7),
 *   mid-year high in July/August (1.3), June and November (1.2), otherwise 1.0
 * - Trend: linear growth from 1.0 at window start to 1.5 at window end
 * - Weekday: weekend 1.3, Friday 1.1, otherwise 1.0
 * - Noise: uniform in [0.8, 1.2], re-sampled on every call
 *
 * Repeated calls for the same date are not expected to return the same value.
 *
 * @author Sales Data Team
 */
public class DemandCurveModel {

    static final int MIN_BASE_ORDERS = 5;
    static final int MAX_BASE_ORDERS = 15;
    static final double MIN_NOISE = 0.8;
    static final double MAX_NOISE = 1.2;
    static final double TREND_GROWTH = 0.5;

    private final SimulationWindow window;
    private final Random random;

    public DemandCurveModel(SimulationWindow window, Random random) {
        this.window = Objects.requireNonNull(window, "window");
        this.random = Objects.requireNonNull(random, "random");
    }

    public SimulationWindow getWindow() {
        return window;
    }

    /**
     * Seasonal multiplier by month.
     *
     * @param date Calendar day
     * @return Multiplier in [0.7, 1.5]
     */
    public double seasonalMultiplier(LocalDate date) {
        switch (date.getMonth()) {
            case DECEMBER:
                return 1.5;
            case JANUARY:
            case FEBRUARY:
                return 0.7;
            case JULY:
            case AUGUST:
                return 1.3;
            case JUNE:
            case NOVEMBER:
                return 1.2;
            default:
                return 1.0;
        }
    }

    /**
     * Linear business growth over the window. Dates outside the window are clamped to its ends.
     *
     * @param date Calendar day
     * @return Multiplier in [1.0, 1.5]
     */
    public double trendMultiplier(LocalDate date) {
        long totalDays = window.totalDays();
        if (totalDays == 0) {
            return 1.0;
        }
        double progress = (double) window.daysSinceStart(date) / totalDays;
        progress = Math.max(0.0, Math.min(1.0, progress));
        return 1.0 + TREND_GROWTH * progress;
    }

    /**
     * Day-of-week multiplier.
     *
     * @param date Calendar day
     * @return 1.3 on weekends, 1.1 on Fridays, 1.0 otherwise
     */
    public double weekdayMultiplier(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return 1.3;
        }
        if (day == DayOfWeek.FRIDAY) {
            return 1.1;
        }
        return 1.0;
    }

    double sampleNoise() {
        return MIN_NOISE + random.nextDouble() * (MAX_NOISE - MIN_NOISE);
    }

    /**
     * Demand intensity for a day, noise included. Always strictly positive.
     *
     * @param date Calendar day
     * @return Intensity
     */
    public double intensity(LocalDate date) {
        return seasonalMultiplier(date) * trendMultiplier(date) * weekdayMultiplier(date) * sampleNoise();
    }

    /**
     * Number of orders to generate for a day: max(1, round(base x intensity)) with base
     * drawn uniformly from [5, 15].
     *
     * @param date Calendar day
     * @return Order count, at least 1
     */
    public int dailyTransactionCount(LocalDate date) {
        int base = MIN_BASE_ORDERS + random.nextInt(MAX_BASE_ORDERS - MIN_BASE_ORDERS + 1);
        long count = Math.round(base * intensity(date));
        return (int) Math.max(1L, count);
    }
}
