package com.safepocket.forecast.operation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.calendar.DateTolerance;
import com.safepocket.forecast.calendar.NotPeriodicException;
import com.safepocket.forecast.calendar.RecurringDateRange;
import com.safepocket.forecast.calendar.Split;
import com.safepocket.forecast.model.Amount;
import com.safepocket.forecast.model.Category;
import java.time.LocalDate;
import java.time.Period;
import org.junit.jupiter.api.Test;

class PlannedOperationTest {

    @Test
    void acceptsOnlySingleDayIntervals() {
        Amount salary = Amount.of(2500, "EUR");

        assertThatThrownBy(() -> new PlannedOperation("Salary", salary, Category.SALARY,
                new DateSpan(LocalDate.parse("2025-01-01"), Period.ofMonths(1))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PlannedOperation("Salary", salary, Category.SALARY,
                new RecurringDateRange(new DateSpan(LocalDate.parse("2025-01-01"), Period.ofDays(2)), Period.ofMonths(1))))
                .isInstanceOf(IllegalArgumentException.class);

        PlannedOperation monthly = new PlannedOperation("Salary", salary, Category.SALARY,
                RecurringDateRange.recurringDay(LocalDate.parse("2025-01-28"), Period.ofMonths(1)));
        assertThat(monthly.criteria().dateTolerance()).isEqualTo(DateTolerance.days(5));
        assertThat(monthly.criteria().amountTolerance()).isEqualTo(AmountTolerance.ratio(0.05));
        assertThat(monthly.archived()).isFalse();
    }

    @Test
    void splitCarriesCriteriaToContinuation() {
        PlannedOperation rent = new PlannedOperation("Rent", Amount.of(-800, "EUR"), Category.RENT,
                RecurringDateRange.recurringDay(LocalDate.parse("2025-01-05"), Period.ofMonths(1)))
                .withId(3L)
                .withCriteria(MatchCriteria.plannedOperationDefaults().withDateTolerance(DateTolerance.days(2)));

        Split<PlannedOperation> split = rent.splitAt(LocalDate.parse("2025-06-01"));

        assertThat(split.terminated().id()).isEqualTo(3L);
        assertThat(split.terminated().dateRange().lastDate()).isEqualTo(LocalDate.parse("2025-06-04"));
        assertThat(split.continuation().id()).isNull();
        assertThat(split.continuation().dateRange().startDate()).isEqualTo(LocalDate.parse("2025-06-05"));
        assertThat(split.continuation().criteria().dateTolerance()).isEqualTo(DateTolerance.days(2));
    }

    @Test
    void oneOffOperationCannotBeSplit() {
        PlannedOperation gift = new PlannedOperation("Gift", Amount.of(-100, "EUR"), Category.GIFTS,
                DateSpan.singleDay(LocalDate.parse("2025-12-20")));

        assertThatThrownBy(() -> gift.splitAt(LocalDate.parse("2025-12-25")))
                .isInstanceOf(NotPeriodicException.class);
    }
}
