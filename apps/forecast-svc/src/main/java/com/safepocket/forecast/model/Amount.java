package com.safepocket.forecast.model;

/**
 * Signed monetary value. Positive values are income, negative values are expenses.
 */
public record Amount(double value, String currency) {

    public Amount {
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("currency must be provided");
        }
    }

    public static Amount of(double value, String currency) {
        return new Amount(value, currency);
    }

    public static Amount zero(String currency) {
        return new Amount(0.0, currency);
    }

    public Amount plus(Amount other) {
        requireSameCurrency(other);
        return new Amount(value + other.value, currency);
    }

    public Amount minus(Amount other) {
        requireSameCurrency(other);
        return new Amount(value - other.value, currency);
    }

    public Amount negate() {
        return new Amount(-value, currency);
    }

    public Amount times(double factor) {
        return new Amount(value * factor, currency);
    }

    public Amount abs() {
        return new Amount(Math.abs(value), currency);
    }

    public boolean isZero() {
        return value == 0.0;
    }

    private void requireSameCurrency(Amount other) {
        if (!currency.equals(other.currency)) {
            throw new CurrencyMismatchException(currency, other.currency);
        }
    }
}
