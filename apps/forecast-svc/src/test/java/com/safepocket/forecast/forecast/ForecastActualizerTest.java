package com.safepocket.forecast.forecast;

import static org.assertj.core.api.Assertions.assertThat;

import com.safepocket.forecast.calendar.DateRange;
import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.calendar.RecurringDateRange;
import com.safepocket.forecast.model.Account;
import com.safepocket.forecast.model.Amount;
import com.safepocket.forecast.model.Category;
import com.safepocket.forecast.model.HistoricOperation;
import com.safepocket.forecast.model.LinkType;
import com.safepocket.forecast.model.OperationLink;
import com.safepocket.forecast.operation.Budget;
import com.safepocket.forecast.operation.MatchCriteria;
import com.safepocket.forecast.operation.PlannedOperation;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import org.junit.jupiter.api.Test;

class ForecastActualizerTest {

    @Test
    void linkedIterationMovesRentToNextMonth() {
        PlannedOperation rent = monthlyRent(1L, "2025-01-01");
        HistoricOperation paid = operation(10, -800, "2025-01-02", Category.RENT);
        Account account = account("2025-01-20", paid);
        OperationLink link = OperationLink.automatic(10, LinkType.PLANNED_OPERATION, 1L, LocalDate.parse("2025-01-01"));

        Forecast result = new ForecastActualizer(account, List.of(link)).actualize(forecast(rent));

        assertThat(result.operations()).singleElement().satisfies(operation -> {
            assertThat(operation.id()).isEqualTo(1L);
            assertThat(operation.dateRange().startDate()).isEqualTo(LocalDate.parse("2025-02-01"));
        });
    }

    @Test
    void unlinkedIterationOutsideToleranceIsNotLate() {
        PlannedOperation rent = monthlyRent(1L, "2025-01-01");

        Forecast result = new ForecastActualizer(account("2025-01-20"), List.of()).actualize(forecast(rent));

        assertThat(result.operations()).singleElement()
                .extracting(operation -> operation.dateRange().startDate())
                .isEqualTo(LocalDate.parse("2025-02-01"));
    }

    @Test
    void pastIterationAdvancesToNextOne() {
        PlannedOperation rent = monthlyRent(1L, "2022-12-20");

        Forecast result = new ForecastActualizer(account("2023-01-01"), List.of()).actualize(forecast(rent));

        assertThat(result.operations()).singleElement()
                .extracting(operation -> operation.dateRange().startDate())
                .isEqualTo(LocalDate.parse("2023-01-20"));
    }

    @Test
    void lateIterationIsPostponedNotDropped() {
        PlannedOperation rent = monthlyRent(5L, "2022-12-28");

        Forecast result = new ForecastActualizer(account("2023-01-01"), List.of()).actualize(forecast(rent));

        assertThat(result.operations()).extracting(PlannedOperation::dateRange).containsExactly(
                DateSpan.singleDay(LocalDate.parse("2023-01-02")),
                RecurringDateRange.recurringDay(LocalDate.parse("2023-01-28"), Period.ofMonths(1))
        );
        assertThat(result.operations()).extracting(PlannedOperation::id).containsOnly(5L);
    }

    @Test
    void lateOneOffOperationIsPostponedAlone() {
        PlannedOperation repair = new PlannedOperation(8L, "Boiler repair", Amount.of(-300, "EUR"), Category.HOUSE_WORKS,
                DateSpan.singleDay(LocalDate.parse("2022-12-30")), MatchCriteria.plannedOperationDefaults(), false);

        Forecast result = new ForecastActualizer(account("2023-01-01"), List.of()).actualize(forecast(repair));

        assertThat(result.operations()).extracting(PlannedOperation::dateRange)
                .containsExactly(DateSpan.singleDay(LocalDate.parse("2023-01-02")));
    }

    @Test
    void linkedDueIterationIsNotLate() {
        PlannedOperation rent = monthlyRent(5L, "2022-12-28");
        HistoricOperation paid = operation(11, -800, "2022-12-29", Category.RENT);
        OperationLink link = OperationLink.automatic(11, LinkType.PLANNED_OPERATION, 5L, LocalDate.parse("2022-12-28"));

        Forecast result = new ForecastActualizer(account("2023-01-01", paid), List.of(link)).actualize(forecast(rent));

        assertThat(result.operations()).singleElement()
                .extracting(operation -> operation.dateRange().startDate())
                .isEqualTo(LocalDate.parse("2023-01-28"));
    }

    @Test
    void unsavedOperationIsOnlyAdvanced() {
        PlannedOperation rent = monthlyRent(null, "2022-12-28");

        Forecast result = new ForecastActualizer(account("2023-01-01"), List.of()).actualize(forecast(rent));

        assertThat(result.operations()).singleElement()
                .extracting(operation -> operation.dateRange().startDate())
                .isEqualTo(LocalDate.parse("2023-01-28"));
    }

    @Test
    void earlyLinkedPaymentSkipsFutureIteration() {
        PlannedOperation rent = monthlyRent(1L, "2025-01-01");
        HistoricOperation paidEarly = operation(12, -800, "2025-01-18", Category.RENT);
        OperationLink link = OperationLink.manual(12, LinkType.PLANNED_OPERATION, 1L, LocalDate.parse("2025-02-01"), null);

        Forecast result = new ForecastActualizer(account("2025-01-20", paidEarly), List.of(link)).actualize(forecast(rent));

        assertThat(result.operations()).singleElement()
                .extracting(operation -> operation.dateRange().startDate())
                .isEqualTo(LocalDate.parse("2025-03-01"));
    }

    @Test
    void pastOneOffOperationIsDroppedAndFutureOneKept() {
        PlannedOperation past = new PlannedOperation(6L, "Gift", Amount.of(-50, "EUR"), Category.GIFTS,
                DateSpan.singleDay(LocalDate.parse("2022-12-15")), MatchCriteria.plannedOperationDefaults(), false);
        PlannedOperation future = past.withId(7L).withDateRange(DateSpan.singleDay(LocalDate.parse("2023-02-15")));

        Forecast result = new ForecastActualizer(account("2023-01-01"), List.of())
                .actualize(new Forecast(List.of(past, future), List.of()));

        assertThat(result.operations()).containsExactly(future);
    }

    @Test
    void linkedSpendingReducesCurrentBudgetIteration() {
        Budget groceries = monthlyBudget(3L, -100, "2022-12-01");
        HistoricOperation spent = operation(20, -30, "2023-01-10", Category.GROCERIES);
        OperationLink link = OperationLink.automatic(20, LinkType.BUDGET, 3L, LocalDate.parse("2023-01-01"));

        Forecast result = new ForecastActualizer(account("2023-01-15", spent), List.of(link))
                .actualize(new Forecast(List.of(), List.of(groceries)));

        assertThat(result.budgets()).hasSize(2);
        Budget remainder = result.budgets().get(0);
        assertThat(remainder.amount()).isEqualTo(Amount.of(-70, "EUR"));
        assertThat(remainder.dateRange()).isEqualTo(
                DateSpan.between(LocalDate.parse("2023-01-16"), LocalDate.parse("2023-01-31")));
        Budget renewal = result.budgets().get(1);
        assertThat(renewal.amount()).isEqualTo(Amount.of(-100, "EUR"));
        assertThat(renewal.dateRange().startDate()).isEqualTo(LocalDate.parse("2023-02-01"));
        assertThat(renewal.id()).isEqualTo(3L);
    }

    @Test
    void budgetConsumptionIsClampedAndSkipsRefunds() {
        Budget groceries = monthlyBudget(3L, -100, "2022-12-01");
        HistoricOperation refund = operation(21, 50, "2023-01-03", Category.GROCERIES);
        HistoricOperation bigShop = operation(22, -70, "2023-01-05", Category.GROCERIES);
        HistoricOperation overspend = operation(23, -80, "2023-01-08", Category.GROCERIES);
        List<OperationLink> links = List.of(
                OperationLink.automatic(21, LinkType.BUDGET, 3L, LocalDate.parse("2023-01-01")),
                OperationLink.automatic(22, LinkType.BUDGET, 3L, LocalDate.parse("2023-01-01")),
                OperationLink.automatic(23, LinkType.BUDGET, 3L, LocalDate.parse("2023-01-01")));

        Forecast result = new ForecastActualizer(account("2023-01-15", refund, bigShop, overspend), links)
                .actualize(new Forecast(List.of(), List.of(groceries)));

        assertThat(result.budgets()).singleElement()
                .extracting(budget -> budget.dateRange().startDate())
                .isEqualTo(LocalDate.parse("2023-02-01"));
    }

    @Test
    void expiredBudgetIsDroppedAndFutureBudgetKept() {
        Budget november = new Budget(4L, "Holidays", Amount.of(-500, "EUR"), Category.HOLIDAYS,
                new DateSpan(LocalDate.parse("2022-11-01"), Period.ofMonths(1)), MatchCriteria.budgetDefaults());
        Budget march = november.withId(5L).withDateRange(new DateSpan(LocalDate.parse("2023-03-01"), Period.ofMonths(1)));

        Forecast result = new ForecastActualizer(account("2023-01-15"), List.of())
                .actualize(new Forecast(List.of(), List.of(march, november)));

        assertThat(result.budgets()).containsExactly(march);
    }

    @Test
    void budgetEndingOnBalanceDateOnlyRenews() {
        Budget groceries = monthlyBudget(3L, -100, "2022-12-01");

        Forecast result = new ForecastActualizer(account("2023-01-31"), List.of())
                .actualize(new Forecast(List.of(), List.of(groceries)));

        assertThat(result.budgets()).extracting(Budget::dateRange).extracting(DateRange::startDate)
                .containsExactly(LocalDate.parse("2023-02-01"));
    }

    @Test
    void archivedOperationIsLeftAsIs() {
        PlannedOperation archived = monthlyRent(9L, "2022-12-28").withArchived(true);

        Forecast result = new ForecastActualizer(account("2023-01-01"), List.of()).actualize(forecast(archived));

        assertThat(result.operations()).containsExactly(archived);
    }

    private static PlannedOperation monthlyRent(Long id, String start) {
        return new PlannedOperation(id, "Rent", Amount.of(-800, "EUR"), Category.RENT,
                RecurringDateRange.recurringDay(LocalDate.parse(start), Period.ofMonths(1)),
                MatchCriteria.plannedOperationDefaults(), false);
    }

    private static Budget monthlyBudget(Long id, double amount, String start) {
        return new Budget(id, "Groceries", Amount.of(amount, "EUR"), Category.GROCERIES,
                new RecurringDateRange(new DateSpan(LocalDate.parse(start), Period.ofMonths(1)), Period.ofMonths(1)),
                MatchCriteria.budgetDefaults());
    }

    private static Forecast forecast(PlannedOperation operation) {
        return new Forecast(List.of(operation), List.of());
    }

    private static HistoricOperation operation(long id, double amount, String date, Category category) {
        return new HistoricOperation(id, "Card payment", Amount.of(amount, "EUR"), category, LocalDate.parse(date));
    }

    private static Account account(String balanceDate, HistoricOperation... operations) {
        return new Account("Main", 1500, "EUR", LocalDate.parse(balanceDate), List.of(operations));
    }
}
