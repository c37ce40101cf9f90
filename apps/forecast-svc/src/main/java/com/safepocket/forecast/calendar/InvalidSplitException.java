package com.safepocket.forecast.calendar;

import com.safepocket.forecast.model.ForecastDomainException;

public class InvalidSplitException extends ForecastDomainException {

    public InvalidSplitException(String message) {
        super(message);
    }
}
