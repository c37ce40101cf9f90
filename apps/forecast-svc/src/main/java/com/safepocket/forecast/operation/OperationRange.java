package com.safepocket.forecast.operation;

import com.safepocket.forecast.calendar.DateRange;
import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.model.Amount;
import com.safepocket.forecast.model.Category;
import com.safepocket.forecast.model.LinkType;
import java.time.LocalDate;
import java.util.Iterator;

/**
 * An amount of money expected in a category over a {@link DateRange}. The amount applies to each iteration.
 */
public interface OperationRange {

    /**
     * Persisted identifier, {@code null} until stored.
     */
    Long id();

    String description();

    Amount amount();

    Category category();

    DateRange dateRange();

    MatchCriteria criteria();

    LinkType linkType();

    /**
     * Share of the amount falling in {@code [from, to]}. Iterations partially inside the window count
     * pro rata per day.
     */
    default Amount amountOnPeriod(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        Amount total = Amount.zero(amount().currency());
        DateRange range = dateRange();
        if (range.isExpired(from) || range.isFuture(to)) {
            return total;
        }
        Iterator<DateSpan> iterations = range.iterate(from).iterator();
        while (iterations.hasNext()) {
            DateSpan iteration = iterations.next();
            if (iteration.isFuture(to)) {
                break;
            }
            if (iteration.isExpired(from)) {
                continue;
            }
            long overlap = iteration.overlapDays(from, to);
            if (overlap == iteration.totalDays()) {
                total = total.plus(amount());
            } else {
                total = total.plus(amount().times((double) overlap / iteration.totalDays()));
            }
        }
        return total;
    }
}
