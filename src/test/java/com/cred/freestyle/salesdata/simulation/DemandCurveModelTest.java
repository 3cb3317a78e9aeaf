package com.cred.freestyle.salesdata.simulation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for DemandCurveModel.
 */
@DisplayName("DemandCurveModel Tests")
class DemandCurveModelTest {

    private static final LocalDate START = LocalDate.of(2023, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 12, 31);

    private DemandCurveModel model;

    @BeforeEach
    void setUp() {
        model = new DemandCurveModel(new SimulationWindow(START, END), new Random(7));
    }

    // ========================================
    // Seasonal multiplier
    // ========================================

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "2024-12-15, 1.5",
            "2024-01-10, 0.7",
            "2024-02-20, 0.7",
            "2024-07-04, 1.3",
            "2024-08-31, 1.3",
            "2024-06-01, 1.2",
            "2024-11-29, 1.2",
            "2024-03-15, 1.0",
            "2024-10-01, 1.0"
    })
    @DisplayName("seasonalMultiplier - Month table")
    void seasonalMultiplier_FollowsMonthTable(LocalDate date, double expected) {
        assertThat(model.seasonalMultiplier(date)).isEqualTo(expected);
    }

    // ========================================
    // Trend multiplier
    // ========================================

    @Test
    @DisplayName("trendMultiplier - 1.0 at window start, 1.5 at window end")
    void trendMultiplier_GrowsLinearlyAcrossWindow() {
        assertThat(model.trendMultiplier(START)).isEqualTo(1.0);
        assertThat(model.trendMultiplier(END)).isCloseTo(1.5, within(1e-9));

        LocalDate middle = START.plusDays(new SimulationWindow(START, END).totalDays() / 2);
        assertThat(model.trendMultiplier(middle)).isCloseTo(1.25, within(0.01));
    }

    @Test
    @DisplayName("trendMultiplier - Single-day window yields 1.0")
    void trendMultiplier_SingleDayWindow_ReturnsOne() {
        // Given
        LocalDate day = LocalDate.of(2024, 5, 5);
        DemandCurveModel singleDay = new DemandCurveModel(new SimulationWindow(day, day), new Random(1));

        // When / Then
        assertThat(singleDay.trendMultiplier(day)).isEqualTo(1.0);
        assertThat(singleDay.dailyTransactionCount(day)).isGreaterThanOrEqualTo(1);
    }

    @Test
    @DisplayName("trendMultiplier - Dates outside the window are clamped")
    void trendMultiplier_OutsideWindow_Clamped() {
        assertThat(model.trendMultiplier(START.minusDays(30))).isEqualTo(1.0);
        assertThat(model.trendMultiplier(END.plusDays(30))).isCloseTo(1.5, within(1e-9));
    }

    // ========================================
    // Weekday multiplier
    // ========================================

    @Test
    @DisplayName("weekdayMultiplier - Weekend 1.3, Friday 1.1, otherwise 1.0")
    void weekdayMultiplier_WeekendAndFriday() {
        assertThat(model.weekdayMultiplier(LocalDate.of(2024, 6, 8))).isEqualTo(1.3);  // Saturday
        assertThat(model.weekdayMultiplier(LocalDate.of(2024, 6, 9))).isEqualTo(1.3);  // Sunday
        assertThat(model.weekdayMultiplier(LocalDate.of(2024, 6, 7))).isEqualTo(1.1);  // Friday
        assertThat(model.weekdayMultiplier(LocalDate.of(2024, 6, 5))).isEqualTo(1.0);  // Wednesday
    }

    // ========================================
    // Intensity and daily count
    // ========================================

    @Test
    @DisplayName("intensity - Strictly positive and within noise bounds for every day of the window")
    void intensity_AlwaysPositiveAndBounded() {
        for (LocalDate day = START; !day.isAfter(END); day = day.plusDays(1)) {
            double deterministic = model.seasonalMultiplier(day) * model.trendMultiplier(day) * model.weekdayMultiplier(day);
            double intensity = model.intensity(day);

            assertThat(intensity).isPositive();
            assertThat(intensity).isBetween(deterministic * 0.8 - 1e-9, deterministic * 1.2 + 1e-9);
        }
    }

    @Test
    @DisplayName("dailyTransactionCount - At least 1 and within base x intensity bounds")
    void dailyTransactionCount_BoundedByBaseAndIntensity() {
        for (LocalDate day = START; !day.isAfter(END); day = day.plusDays(1)) {
            double deterministic = model.seasonalMultiplier(day) * model.trendMultiplier(day) * model.weekdayMultiplier(day);
            int count = model.dailyTransactionCount(day);

            assertThat(count).isGreaterThanOrEqualTo(1);
            assertThat(count).isLessThanOrEqualTo((int) Math.round(15 * deterministic * 1.2) + 1);
            assertThat(count).isGreaterThanOrEqualTo(Math.max(1, (int) Math.round(5 * deterministic * 0.8) - 1));
        }
    }

    @Test
    @DisplayName("dailyTransactionCount - December weekends outsell February weekdays on average")
    void dailyTransactionCount_SeasonalityVisibleOnAverage() {
        LocalDate decemberSaturday = LocalDate.of(2024, 12, 14);
        LocalDate februaryTuesday = LocalDate.of(2024, 2, 13);

        double december = 0;
        double february = 0;
        for (int i = 0; i < 500; i++) {
            december += model.dailyTransactionCount(decemberSaturday);
            february += model.dailyTransactionCount(februaryTuesday);
        }

        assertThat(december / 500).isGreaterThan(february / 500 * 2);
    }

    @Test
    @DisplayName("dailyTransactionCount - Same seed gives the same sequence")
    void dailyTransactionCount_SeededIsReproducible() {
        DemandCurveModel first = new DemandCurveModel(new SimulationWindow(START, END), new Random(42));
        DemandCurveModel second = new DemandCurveModel(new SimulationWindow(START, END), new Random(42));

        for (LocalDate day = START; day.isBefore(START.plusDays(60)); day = day.plusDays(1)) {
            assertThat(first.dailyTransactionCount(day)).isEqualTo(second.dailyTransactionCount(day));
        }
    }
}
