package com.safepocket.forecast.operation;

import com.safepocket.forecast.calendar.DateRange;
import com.safepocket.forecast.calendar.NotPeriodicException;
import com.safepocket.forecast.calendar.RecurringDateRange;
import com.safepocket.forecast.calendar.Split;
import com.safepocket.forecast.model.Amount;
import com.safepocket.forecast.model.Category;
import com.safepocket.forecast.model.LinkType;
import java.time.LocalDate;

/**
 * Spending envelope: the amount may be consumed by any number of operations during each iteration.
 */
public record Budget(
        Long id,
        String description,
        Amount amount,
        Category category,
        DateRange dateRange,
        MatchCriteria criteria
) implements OperationRange {

    public Budget {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description must be provided");
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount must be provided");
        }
        if (category == null) {
            throw new IllegalArgumentException("category must be provided");
        }
        if (dateRange == null) {
            throw new IllegalArgumentException("dateRange must be provided");
        }
        if (criteria == null) {
            criteria = MatchCriteria.budgetDefaults();
        }
    }

    public Budget(String description, Amount amount, Category category, DateRange dateRange) {
        this(null, description, amount, category, dateRange, MatchCriteria.budgetDefaults());
    }

    @Override
    public LinkType linkType() {
        return LinkType.BUDGET;
    }

    public Budget withId(Long newId) {
        return new Budget(newId, description, amount, category, dateRange, criteria);
    }

    public Budget withDescription(String newDescription) {
        return new Budget(id, newDescription, amount, category, dateRange, criteria);
    }

    public Budget withAmount(Amount newAmount) {
        return new Budget(id, description, newAmount, category, dateRange, criteria);
    }

    public Budget withCategory(Category newCategory) {
        return new Budget(id, description, amount, newCategory, dateRange, criteria);
    }

    public Budget withDateRange(DateRange newDateRange) {
        return new Budget(id, description, amount, category, newDateRange, criteria);
    }

    public Budget withCriteria(MatchCriteria newCriteria) {
        return new Budget(id, description, amount, category, dateRange, newCriteria);
    }

    /**
     * The terminated side keeps this budget's id, the continuation is unpersisted.
     *
     * @throws NotPeriodicException when the budget does not recur
     */
    public Split<Budget> splitAt(LocalDate date) {
        if (!(dateRange instanceof RecurringDateRange recurring)) {
            throw new NotPeriodicException("Budget '" + description + "' does not recur and cannot be split");
        }
        Split<RecurringDateRange> ranges = recurring.splitAt(date);
        return new Split<>(
                withDateRange(ranges.terminated()),
                new Budget(null, description, amount, category, ranges.continuation(), criteria)
        );
    }
}
