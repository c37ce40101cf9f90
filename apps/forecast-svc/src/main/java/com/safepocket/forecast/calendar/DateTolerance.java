package com.safepocket.forecast.calendar;

import java.time.LocalDate;

/**
 * Number of days a date may fall before the start or after the end of an interval and still count as inside it.
 */
public record DateTolerance(int daysBefore, int daysAfter) {

    public static final DateTolerance NONE = new DateTolerance(0, 0);

    public DateTolerance {
        if (daysBefore < 0 || daysAfter < 0) {
            throw new IllegalArgumentException("tolerance days must not be negative");
        }
    }

    public static DateTolerance days(int days) {
        return new DateTolerance(days, days);
    }

    public LocalDate widenStart(LocalDate start) {
        return start.minusDays(daysBefore);
    }

    public LocalDate widenEnd(LocalDate end) {
        return end.plusDays(daysAfter);
    }

    public boolean isNone() {
        return daysBefore == 0 && daysAfter == 0;
    }
}
