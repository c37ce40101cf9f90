package com.safepocket.forecast.calendar;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Period;
import java.util.Locale;

public enum PeriodUnit {
    YEARS,
    MONTHS,
    WEEKS,
    DAYS;

    public Period toPeriod(int value) {
        return switch (this) {
            case YEARS -> Period.ofYears(value);
            case MONTHS -> Period.ofMonths(value);
            case WEEKS -> Period.ofWeeks(value);
            case DAYS -> Period.ofDays(value);
        };
    }

    @JsonValue
    public String storedName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PeriodUnit fromStoredName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("period unit must be provided");
        }
        return PeriodUnit.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
