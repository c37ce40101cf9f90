package com.safepocket.forecast.calendar;

import java.time.LocalDate;
import java.time.Period;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.stream.Stream;

public record DateSpan(LocalDate startDate, Period duration) implements DateRange {

    private static final Period ONE_DAY = Period.ofDays(1);

    public DateSpan {
        if (startDate == null) {
            throw new IllegalArgumentException("startDate must be provided");
        }
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be positive");
        }
    }

    public static DateSpan singleDay(LocalDate date) {
        return new DateSpan(date, ONE_DAY);
    }

    public static DateSpan between(LocalDate startDate, LocalDate lastDate) {
        if (lastDate.isBefore(startDate)) {
            throw new IllegalArgumentException("lastDate must not be before startDate");
        }
        return new DateSpan(startDate, Period.ofDays((int) ChronoUnit.DAYS.between(startDate, lastDate) + 1));
    }

    @Override
    public LocalDate lastDate() {
        return startDate.plus(duration).minusDays(1);
    }

    public boolean isSingleDay() {
        return lastDate().equals(startDate);
    }

    @Override
    public Stream<DateSpan> iterate(LocalDate from) {
        return Stream.of(this);
    }

    @Override
    public Optional<DateSpan> currentDateRange(LocalDate date, DateTolerance tolerance) {
        return isWithin(date, tolerance) ? Optional.of(this) : Optional.empty();
    }

    @Override
    public Optional<DateSpan> nextDateRange(LocalDate date) {
        return isFuture(date) ? Optional.of(this) : Optional.empty();
    }

    @Override
    public Optional<DateSpan> lastDateRange(LocalDate date) {
        return isFuture(date) ? Optional.empty() : Optional.of(this);
    }

    @Override
    public boolean isWithin(LocalDate date, DateTolerance tolerance) {
        return !date.isBefore(tolerance.widenStart(startDate)) && !date.isAfter(tolerance.widenEnd(lastDate()));
    }

    @Override
    public DateSpan withStartDate(LocalDate newStartDate) {
        return new DateSpan(newStartDate, duration);
    }

    public DateSpan withDuration(Period newDuration) {
        return new DateSpan(startDate, newDuration);
    }

    /**
     * Number of days shared with {@code [from, to]}, zero when disjoint.
     */
    public long overlapDays(LocalDate from, LocalDate to) {
        LocalDate lower = startDate.isAfter(from) ? startDate : from;
        LocalDate last = lastDate();
        LocalDate upper = last.isBefore(to) ? last : to;
        return upper.isBefore(lower) ? 0 : ChronoUnit.DAYS.between(lower, upper) + 1;
    }
}
