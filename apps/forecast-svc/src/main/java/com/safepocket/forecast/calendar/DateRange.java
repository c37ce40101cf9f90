package com.safepocket.forecast.calendar;

import java.time.LocalDate;
import java.time.Period;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A span of calendar days, either a single {@link DateSpan} or a {@link RecurringDateRange} of spans.
 */
public sealed interface DateRange permits DateSpan, RecurringDateRange {

    Comparator<DateRange> CHRONOLOGICAL = Comparator
            .comparing(DateRange::startDate)
            .thenComparing(DateRange::lastDate);

    LocalDate startDate();

    /**
     * Last day covered, inclusive. For a recurring range this is its expiration date.
     */
    LocalDate lastDate();

    /**
     * Length of one iteration.
     */
    Period duration();

    /**
     * Iterations in ascending order, starting with the one that may still be in progress at {@code from}.
     * The stream is lazy and may be very long for unbounded ranges; consume it with a limit.
     */
    Stream<DateSpan> iterate(LocalDate from);

    default Stream<DateSpan> iterate() {
        return iterate(startDate());
    }

    Optional<DateSpan> currentDateRange(LocalDate date, DateTolerance tolerance);

    default Optional<DateSpan> currentDateRange(LocalDate date) {
        return currentDateRange(date, DateTolerance.NONE);
    }

    /**
     * First iteration starting strictly after {@code date}.
     */
    Optional<DateSpan> nextDateRange(LocalDate date);

    /**
     * Iteration containing {@code date}, or else the latest one that started before it.
     */
    Optional<DateSpan> lastDateRange(LocalDate date);

    DateRange withStartDate(LocalDate newStartDate);

    boolean isWithin(LocalDate date, DateTolerance tolerance);

    default boolean isWithin(LocalDate date) {
        return isWithin(date, DateTolerance.NONE);
    }

    default boolean isExpired(LocalDate date) {
        return lastDate().isBefore(date);
    }

    default boolean isFuture(LocalDate date) {
        return startDate().isAfter(date);
    }

    default long totalDays() {
        return ChronoUnit.DAYS.between(startDate(), lastDate()) + 1;
    }
}
