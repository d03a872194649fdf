package com.cryptofolio.backend.portfolio;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.util.List;
import java.util.Objects;

/**
 * Decides which timestamps of a series are rebalancing boundaries. Calendar periods are read in
 * the configured zone; the first timestamp is never a boundary because it carries the initial
 * allocation.
 */
public class RebalanceSchedule {

    private final ZoneId zone;
    private final WeeklyBoundary weeklyBoundary;

    public RebalanceSchedule() {
        this(ZoneOffset.UTC, WeeklyBoundary.ISO_WEEK);
    }

    public RebalanceSchedule(ZoneId zone, WeeklyBoundary weeklyBoundary) {
        this.zone = Objects.requireNonNull(zone, "zone");
        this.weeklyBoundary = Objects.requireNonNull(weeklyBoundary, "weeklyBoundary");
    }

    public boolean[] boundaries(List<Instant> timestamps, RebalancingFrequency frequency) {
        Objects.requireNonNull(frequency, "frequency");
        boolean[] boundaries = new boolean[timestamps.size()];
        if (timestamps.isEmpty() || frequency == RebalancingFrequency.NONE) {
            return boundaries;
        }
        LocalDate origin = localDate(timestamps.get(0));
        LocalDate previous = origin;
        for (int i = 1; i < timestamps.size(); i++) {
            LocalDate current = localDate(timestamps.get(i));
            boundaries[i] = isBoundary(origin, previous, current, frequency);
            previous = current;
        }
        return boundaries;
    }

    private boolean isBoundary(LocalDate origin, LocalDate previous, LocalDate current, RebalancingFrequency frequency) {
        return switch (frequency) {
            case NONE -> false;
            case DAILY -> !current.equals(previous);
            case WEEKLY -> weeklyBoundary == WeeklyBoundary.ISO_WEEK
                    ? isoWeek(current) != isoWeek(previous)
                    : stride(origin, current) != stride(origin, previous);
            case MONTHLY -> !YearMonth.from(current).equals(YearMonth.from(previous));
        };
    }

    private LocalDate localDate(Instant timestamp) {
        return timestamp.atZone(zone).toLocalDate();
    }

    private static long isoWeek(LocalDate date) {
        return date.get(IsoFields.WEEK_BASED_YEAR) * 100L + date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    private static long stride(LocalDate origin, LocalDate date) {
        return ChronoUnit.DAYS.between(origin, date) / 7;
    }
}
