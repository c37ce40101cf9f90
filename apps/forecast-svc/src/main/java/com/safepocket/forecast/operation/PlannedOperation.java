package com.safepocket.forecast.operation;

import com.safepocket.forecast.calendar.DateRange;
import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.calendar.NotPeriodicException;
import com.safepocket.forecast.calendar.RecurringDateRange;
import com.safepocket.forecast.calendar.Split;
import com.safepocket.forecast.model.Amount;
import com.safepocket.forecast.model.Category;
import com.safepocket.forecast.model.LinkType;
import java.time.LocalDate;

/**
 * Expected transaction happening on a single day, once or periodically.
 */
public record PlannedOperation(
        Long id,
        String description,
        Amount amount,
        Category category,
        DateRange dateRange,
        MatchCriteria criteria,
        boolean archived
) implements OperationRange {

    public PlannedOperation {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description must be provided");
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount must be provided");
        }
        if (category == null) {
            throw new IllegalArgumentException("category must be provided");
        }
        if (!isSingleDayBased(dateRange)) {
            throw new IllegalArgumentException("planned operations must happen on a single day or on a recurring day");
        }
        if (criteria == null) {
            criteria = MatchCriteria.plannedOperationDefaults();
        }
    }

    public PlannedOperation(String description, Amount amount, Category category, DateRange dateRange) {
        this(null, description, amount, category, dateRange, MatchCriteria.plannedOperationDefaults(), false);
    }

    private static boolean isSingleDayBased(DateRange dateRange) {
        if (dateRange instanceof DateSpan span) {
            return span.isSingleDay();
        }
        if (dateRange instanceof RecurringDateRange recurring) {
            return recurring.base().isSingleDay();
        }
        return false;
    }

    @Override
    public LinkType linkType() {
        return LinkType.PLANNED_OPERATION;
    }

    public PlannedOperation withId(Long newId) {
        return new PlannedOperation(newId, description, amount, category, dateRange, criteria, archived);
    }

    public PlannedOperation withDescription(String newDescription) {
        return new PlannedOperation(id, newDescription, amount, category, dateRange, criteria, archived);
    }

    public PlannedOperation withAmount(Amount newAmount) {
        return new PlannedOperation(id, description, newAmount, category, dateRange, criteria, archived);
    }

    public PlannedOperation withCategory(Category newCategory) {
        return new PlannedOperation(id, description, amount, newCategory, dateRange, criteria, archived);
    }

    public PlannedOperation withDateRange(DateRange newDateRange) {
        return new PlannedOperation(id, description, amount, category, newDateRange, criteria, archived);
    }

    public PlannedOperation withCriteria(MatchCriteria newCriteria) {
        return new PlannedOperation(id, description, amount, category, dateRange, newCriteria, archived);
    }

    public PlannedOperation withArchived(boolean newArchived) {
        return new PlannedOperation(id, description, amount, category, dateRange, criteria, newArchived);
    }

    /**
     * The terminated side keeps this operation's id, the continuation is unpersisted.
     *
     * @throws NotPeriodicException when the operation does not recur
     */
    public Split<PlannedOperation> splitAt(LocalDate date) {
        if (!(dateRange instanceof RecurringDateRange recurring)) {
            throw new NotPeriodicException("Planned operation '" + description + "' does not recur and cannot be split");
        }
        Split<RecurringDateRange> ranges = recurring.splitAt(date);
        return new Split<>(
                withDateRange(ranges.terminated()),
                new PlannedOperation(null, description, amount, category, ranges.continuation(), criteria, archived)
        );
    }
}
