package com.safepocket.forecast.calendar;

import java.time.Period;

/**
 * A {@link Period} flattened to a single {@code (value, unit)} pair for storage.
 */
public record StoredPeriod(int value, PeriodUnit unit) {

    public StoredPeriod {
        if (unit == null) {
            throw new IllegalArgumentException("unit must be provided");
        }
        if (value < 0) {
            throw new IllegalArgumentException("value must not be negative");
        }
    }

    /**
     * Picks the unit by checking years, then months, then days. Weeks are only ever read back, since a
     * {@link Period} keeps them as days.
     *
     * @throws IllegalArgumentException when the period mixes days with months or years
     */
    public static StoredPeriod of(Period period) {
        if (period.getDays() != 0 && period.toTotalMonths() != 0) {
            throw new IllegalArgumentException("Period " + period + " cannot be stored as a single unit");
        }
        if (period.getYears() != 0 && period.getMonths() == 0) {
            return new StoredPeriod(period.getYears(), PeriodUnit.YEARS);
        }
        if (period.toTotalMonths() != 0) {
            return new StoredPeriod(Math.toIntExact(period.toTotalMonths()), PeriodUnit.MONTHS);
        }
        return new StoredPeriod(period.getDays(), PeriodUnit.DAYS);
    }

    public Period toPeriod() {
        return unit.toPeriod(value);
    }
}
