package com.safepocket.forecast.calendar;

import java.time.LocalDate;
import java.time.Period;
import java.time.temporal.ChronoUnit;
import java.util.Iterator;
import java.util.Optional;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * A {@link DateSpan} repeated every {@code period} until {@code expirationDate}.
 * <p>
 * Iteration {@code n} always starts at {@code base.startDate() + n * period}, so month-end starts are
 * clamped per month instead of drifting.
 */
public record RecurringDateRange(DateSpan base, Period period, LocalDate expirationDate) implements DateRange {

    /** Expiration of a range that never ends. */
    public static final LocalDate UNBOUNDED = LocalDate.of(9999, 12, 31);

    private static final int DAYS_PER_YEAR_UPPER_BOUND = 366;
    private static final int DAYS_PER_MONTH_UPPER_BOUND = 31;

    public RecurringDateRange {
        if (base == null) {
            throw new IllegalArgumentException("base must be provided");
        }
        if (period == null || period.isZero() || period.getYears() < 0 || period.getMonths() < 0 || period.getDays() < 0) {
            throw new IllegalArgumentException("period must be positive");
        }
        if (expirationDate == null) {
            expirationDate = UNBOUNDED;
        }
    }

    public RecurringDateRange(DateSpan base, Period period) {
        this(base, period, UNBOUNDED);
    }

    public static RecurringDateRange recurringDay(LocalDate startDate, Period period) {
        return new RecurringDateRange(DateSpan.singleDay(startDate), period, UNBOUNDED);
    }

    public static RecurringDateRange recurringDay(LocalDate startDate, Period period, LocalDate expirationDate) {
        return new RecurringDateRange(DateSpan.singleDay(startDate), period, expirationDate);
    }

    @Override
    public LocalDate startDate() {
        return base.startDate();
    }

    @Override
    public LocalDate lastDate() {
        return expirationDate;
    }

    @Override
    public Period duration() {
        return base.duration();
    }

    public boolean isBounded() {
        return !UNBOUNDED.equals(expirationDate);
    }

    public DateSpan iteration(long index) {
        return base.withStartDate(iterationStart(index));
    }

    private LocalDate iterationStart(long index) {
        return base.startDate().plus(period.multipliedBy(Math.toIntExact(index)));
    }

    @Override
    public Stream<DateSpan> iterate(LocalDate from) {
        long first = 0;
        if (from.isAfter(startDate())) {
            long daysFromStart = ChronoUnit.DAYS.between(startDate(), from);
            first = Math.max(0, daysFromStart / approximatePeriodDays() - 1);
            while (iterationStart(first + 1).isBefore(from)) {
                first++;
            }
        }
        return LongStream.iterate(first, index -> index + 1)
                .mapToObj(this::iteration)
                .takeWhile(iteration -> !iteration.lastDate().isAfter(expirationDate));
    }

    /**
     * Upper bound of the period length in days. Never shorter than the real period, so a seek based on it
     * lands on or before the wanted iteration.
     */
    long approximatePeriodDays() {
        return (long) period.getYears() * DAYS_PER_YEAR_UPPER_BOUND
                + (long) period.getMonths() * DAYS_PER_MONTH_UPPER_BOUND
                + period.getDays();
    }

    @Override
    public Optional<DateSpan> currentDateRange(LocalDate date, DateTolerance tolerance) {
        Iterator<DateSpan> iterations = iterate(date).iterator();
        while (iterations.hasNext()) {
            DateSpan iteration = iterations.next();
            if (iteration.isWithin(date, tolerance)) {
                return Optional.of(iteration);
            }
            if (iteration.isFuture(date)) {
                break;
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<DateSpan> nextDateRange(LocalDate date) {
        return iterate(date)
                .filter(iteration -> iteration.isFuture(date))
                .findFirst();
    }

    @Override
    public Optional<DateSpan> lastDateRange(LocalDate date) {
        DateSpan previous = null;
        Iterator<DateSpan> iterations = iterate(date).iterator();
        while (iterations.hasNext()) {
            DateSpan iteration = iterations.next();
            if (iteration.isWithin(date)) {
                return Optional.of(iteration);
            }
            if (iteration.isFuture(date)) {
                break;
            }
            previous = iteration;
        }
        return Optional.ofNullable(previous);
    }

    @Override
    public boolean isWithin(LocalDate date, DateTolerance tolerance) {
        return currentDateRange(date, tolerance).isPresent();
    }

    @Override
    public boolean isFuture(LocalDate date) {
        return base.isFuture(date);
    }

    /**
     * Cuts the range at the first iteration starting on or after {@code date}.
     *
     * @throws InvalidSplitException when {@code date} is not after the first start or no iteration follows it
     */
    public Split<RecurringDateRange> splitAt(LocalDate date) {
        if (!date.isAfter(startDate())) {
            throw new InvalidSplitException("Split date " + date + " must be after the start date " + startDate());
        }
        DateSpan first = iterate(date)
                .filter(iteration -> !iteration.startDate().isBefore(date))
                .findFirst()
                .orElseThrow(() -> new InvalidSplitException("No iteration starts on or after " + date));
        RecurringDateRange terminated = withExpirationDate(first.startDate().minusDays(1));
        RecurringDateRange continuation = new RecurringDateRange(first, period, expirationDate);
        return new Split<>(terminated, continuation);
    }

    @Override
    public RecurringDateRange withStartDate(LocalDate newStartDate) {
        return new RecurringDateRange(base.withStartDate(newStartDate), period, expirationDate);
    }

    public RecurringDateRange withDuration(Period newDuration) {
        return new RecurringDateRange(base.withDuration(newDuration), period, expirationDate);
    }

    public RecurringDateRange withPeriod(Period newPeriod) {
        return new RecurringDateRange(base, newPeriod, expirationDate);
    }

    public RecurringDateRange withExpirationDate(LocalDate newExpirationDate) {
        return new RecurringDateRange(base, period, newExpirationDate);
    }
}
