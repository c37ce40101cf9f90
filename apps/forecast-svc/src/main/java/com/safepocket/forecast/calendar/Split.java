package com.safepocket.forecast.calendar;

/**
 * Result of cutting a recurring value at a date: {@code terminated} ends the day before
 * {@code continuation} starts.
 */
public record Split<T>(T terminated, T continuation) {

    public Split {
        if (terminated == null || continuation == null) {
            throw new IllegalArgumentException("both sides of a split must be provided");
        }
    }
}
