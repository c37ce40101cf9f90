package com.safepocket.forecast.repository;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.safepocket.forecast.calendar.DateRange;
import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.calendar.PeriodUnit;
import com.safepocket.forecast.calendar.RecurringDateRange;
import com.safepocket.forecast.calendar.StoredPeriod;
import java.time.LocalDate;
import java.time.Period;

/**
 * Stored fields of a {@link DateRange}. A missing duration means a single day, a missing period means no
 * recurrence and a missing end date means a recurrence that never expires.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DateRangeRecord(
        @JsonProperty("start_date") LocalDate startDate,
        @JsonProperty("duration_value") Integer durationValue,
        @JsonProperty("duration_unit") PeriodUnit durationUnit,
        @JsonProperty("period_value") Integer periodValue,
        @JsonProperty("period_unit") PeriodUnit periodUnit,
        @JsonProperty("end_date") LocalDate endDate
) {

    public static DateRangeRecord from(DateRange range) {
        if (range instanceof RecurringDateRange recurring) {
            StoredPeriod duration = storedDuration(recurring.base());
            StoredPeriod period = StoredPeriod.of(recurring.period());
            return new DateRangeRecord(
                    recurring.startDate(),
                    duration == null ? null : duration.value(),
                    duration == null ? null : duration.unit(),
                    period.value(),
                    period.unit(),
                    recurring.isBounded() ? recurring.expirationDate() : null
            );
        }
        DateSpan span = (DateSpan) range;
        StoredPeriod duration = storedDuration(span);
        return new DateRangeRecord(
                span.startDate(),
                duration == null ? null : duration.value(),
                duration == null ? null : duration.unit(),
                null,
                null,
                null
        );
    }

    private static StoredPeriod storedDuration(DateSpan span) {
        return span.isSingleDay() ? null : StoredPeriod.of(span.duration());
    }

    /**
     * @throws IllegalArgumentException when a value is stored without its unit, or recurrence fields are incomplete
     */
    @JsonIgnore
    public DateRange toDateRange() {
        if (startDate == null) {
            throw new IllegalArgumentException("start_date must be provided");
        }
        Period duration = toPeriod("duration", durationValue, durationUnit);
        Period period = toPeriod("period", periodValue, periodUnit);
        DateSpan base = duration == null ? DateSpan.singleDay(startDate) : new DateSpan(startDate, duration);
        if (period == null) {
            if (endDate != null) {
                throw new IllegalArgumentException("end_date requires a period");
            }
            return base;
        }
        return new RecurringDateRange(base, period, endDate);
    }

    private static Period toPeriod(String field, Integer value, PeriodUnit unit) {
        if (value == null && unit == null) {
            return null;
        }
        if (value == null || unit == null) {
            throw new IllegalArgumentException(field + "_value and " + field + "_unit must be provided together");
        }
        return new StoredPeriod(value, unit).toPeriod();
    }
}
