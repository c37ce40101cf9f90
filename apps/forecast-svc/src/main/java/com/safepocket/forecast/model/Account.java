package com.safepocket.forecast.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Snapshot of an account: the balance as of {@code balanceDate} and the operations that led to it.
 */
public record Account(
        String name,
        double balance,
        String currency,
        LocalDate balanceDate,
        List<HistoricOperation> operations
) {
    public Account {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be provided");
        }
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("currency must be provided");
        }
        if (balanceDate == null) {
            throw new IllegalArgumentException("balanceDate must be provided");
        }
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    public Account withState(double newBalance, LocalDate newBalanceDate, List<HistoricOperation> newOperations) {
        return new Account(name, newBalance, currency, newBalanceDate, newOperations);
    }

    public Account withOperations(List<HistoricOperation> newOperations) {
        return new Account(name, balance, currency, balanceDate, newOperations);
    }
}
