package com.safepocket.forecast.model;

/**
 * Base type for structural errors raised by the forecast engine.
 */
public class ForecastDomainException extends RuntimeException {

    public ForecastDomainException(String message) {
        super(message);
    }
}
