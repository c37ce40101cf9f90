package com.safepocket.forecast.calendar;

import com.safepocket.forecast.model.ForecastDomainException;

public class NotPeriodicException extends ForecastDomainException {

    public NotPeriodicException(String message) {
        super(message);
    }
}
