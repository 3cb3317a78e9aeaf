package com.cred.freestyle.salesdata.simulation;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Inclusive range of simulated calendar days. Immutable; start is never after end.
 *
 * @author Sales Data Team
 */
public final class SimulationWindow {

    private final LocalDate startDate;
    private final LocalDate endDate;

    public SimulationWindow(LocalDate startDate, LocalDate endDate) {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException(
                    "Simulation window start " + startDate + " is after end " + endDate);
        }
        this.startDate = startDate;
        this.endDate = endDate;
    }

    /**
     * Window ending today (per the clock's zone) and starting {@code days} days earlier.
     *
     * @param clock Clock
     * @param days Window length in days, non-negative
     * @return Simulation window
     */
    public static SimulationWindow trailing(Clock clock, int days) {
        if (days < 0) {
            throw new IllegalArgumentException("Window length must not be negative: " + days);
        }
        LocalDate today = LocalDate.now(clock);
        return new SimulationWindow(today.minusDays(days), today);
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    /**
     * Days between start and end (0 for a single-day window).
     */
    public long totalDays() {
        return ChronoUnit.DAYS.between(startDate, endDate);
    }

    /**
     * Number of simulated days, both ends included.
     */
    public long dayCount() {
        return totalDays() + 1;
    }

    public long daysSinceStart(LocalDate date) {
        return ChronoUnit.DAYS.between(startDate, date);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimulationWindow)) return false;
        SimulationWindow that = (SimulationWindow) o;
        return startDate.equals(that.startDate) && endDate.equals(that.endDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startDate, endDate);
    }

    @Override
    public String toString() {
        return "SimulationWindow[" + startDate + " .. " + endDate + "]";
    }
}
