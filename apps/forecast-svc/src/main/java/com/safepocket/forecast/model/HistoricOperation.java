package com.safepocket.forecast.model;

import java.time.LocalDate;

public record HistoricOperation(
        long id,
        String description,
        Amount amount,
        Category category,
        LocalDate date
) {
    public HistoricOperation {
        if (description == null) {
            description = "";
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount must be provided");
        }
        if (category == null) {
            category = Category.UNCATEGORIZED;
        }
        if (date == null) {
            throw new IllegalArgumentException("date must be provided");
        }
    }

    public HistoricOperation withCategory(Category newCategory) {
        return new HistoricOperation(id, description, amount, newCategory, date);
    }

    public HistoricOperation withAmount(Amount newAmount) {
        return new HistoricOperation(id, description, newAmount, category, date);
    }
}
