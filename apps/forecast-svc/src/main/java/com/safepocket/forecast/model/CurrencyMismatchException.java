package com.safepocket.forecast.model;

public class CurrencyMismatchException extends ForecastDomainException {

    public CurrencyMismatchException(String left, String right) {
        super("Cannot combine amounts in " + left + " and " + right);
    }
}
