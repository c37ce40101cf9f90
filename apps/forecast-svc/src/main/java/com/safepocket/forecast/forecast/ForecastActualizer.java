package com.safepocket.forecast.forecast;

import com.safepocket.forecast.calendar.DateRange;
import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.calendar.DateTolerance;
import com.safepocket.forecast.model.Account;
import com.safepocket.forecast.model.Amount;
import com.safepocket.forecast.model.HistoricOperation;
import com.safepocket.forecast.model.LinkType;
import com.safepocket.forecast.model.OperationLink;
import com.safepocket.forecast.operation.Budget;
import com.safepocket.forecast.operation.PlannedOperation;
import java.time.LocalDate;
import java.time.Period;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves a forecast forward to an account's balance date.
 * <p>
 * Planned operations are advanced past the iterations the account already explains, and due iterations with no
 * link are postponed to the day after the balance date. Budgets are cut down to what remains of their current
 * iteration, net of the operations linked to it.
 */
public class ForecastActualizer {

    private static final Logger log = LoggerFactory.getLogger(ForecastActualizer.class);

    private final LocalDate balanceDate;
    private final Map<Long, Set<LocalDate>> linkedIterationsByPlannedOperation = new HashMap<>();
    private final Map<IterationKey, Set<Long>> operationsByPlannedIteration = new HashMap<>();
    private final Map<IterationKey, Set<Long>> operationsByBudgetIteration = new HashMap<>();
    private final Map<Long, HistoricOperation> operationsById = new HashMap<>();

    public ForecastActualizer(Account account, Collection<OperationLink> links) {
        this.balanceDate = account.balanceDate();
        for (HistoricOperation operation : account.operations()) {
            operationsById.put(operation.id(), operation);
        }
        for (OperationLink link : links) {
            IterationKey key = new IterationKey(link.targetId(), link.iterationDate());
            if (link.targetType() == LinkType.PLANNED_OPERATION) {
                linkedIterationsByPlannedOperation
                        .computeIfAbsent(link.targetId(), id -> new HashSet<>())
                        .add(link.iterationDate());
                operationsByPlannedIteration.computeIfAbsent(key, k -> new HashSet<>()).add(link.operationId());
            } else {
                operationsByBudgetIteration.computeIfAbsent(key, k -> new HashSet<>()).add(link.operationId());
            }
        }
    }

    public Forecast actualize(Forecast forecast) {
        List<PlannedOperation> operations = forecast.operations().stream()
                .sorted(Comparator.comparing(PlannedOperation::dateRange, Comparator.comparing(DateRange::startDate)))
                .flatMap(this::actualizeOperation)
                .toList();
        List<Budget> budgets = forecast.budgets().stream()
                .sorted(Comparator.comparing(Budget::dateRange, DateRange.CHRONOLOGICAL))
                .flatMap(this::actualizeBudget)
                .toList();
        log.debug("Forecast actualized at {}: {} planned operations, {} budgets",
                balanceDate, operations.size(), budgets.size());
        return new Forecast(operations, budgets);
    }

    private Stream<PlannedOperation> actualizeOperation(PlannedOperation operation) {
        if (operation.archived()) {
            return Stream.of(operation);
        }
        Set<LocalDate> linked = operation.id() == null
                ? Set.of()
                : linkedIterationsByPlannedOperation.getOrDefault(operation.id(), Set.of());

        List<DateSpan> late = operation.id() == null ? List.of() : lateIterations(operation, linked);
        if (!late.isEmpty()) {
            log.debug("Planned operation {} has {} late iteration(s) at {}", operation.id(), late.size(), balanceDate);
            return postpone(operation, late);
        }

        Optional<LocalDate> latestActualized = latestActualizedIteration(operation, linked);
        if (latestActualized.isEmpty()) {
            return Stream.of(operation);
        }
        return advancePast(operation, latestActualized.get()).stream();
    }

    /**
     * Iterations that started before the balance date, are still within their after-tolerance and have no link.
     */
    private List<DateSpan> lateIterations(PlannedOperation operation, Set<LocalDate> linked) {
        DateTolerance tolerance = operation.criteria().dateTolerance();
        List<DateSpan> late = new ArrayList<>();
        Iterator<DateSpan> iterations = operation.dateRange().iterate(balanceDate.minusDays(tolerance.daysAfter())).iterator();
        while (iterations.hasNext()) {
            DateSpan iteration = iterations.next();
            if (!iteration.startDate().isBefore(balanceDate)) {
                break;
            }
            if (balanceDate.isAfter(tolerance.widenEnd(iteration.lastDate()))) {
                continue;
            }
            if (!linked.contains(iteration.startDate())) {
                late.add(iteration);
            }
        }
        return late;
    }

    private Stream<PlannedOperation> postpone(PlannedOperation operation, List<DateSpan> late) {
        LocalDate postponedDate = balanceDate.plusDays(1);
        Stream<PlannedOperation> postponed = late.stream()
                .map(iteration -> operation.withDateRange(DateSpan.singleDay(postponedDate)));
        Optional<PlannedOperation> continuation = operation.dateRange().nextDateRange(postponedDate)
                .map(next -> operation.withDateRange(operation.dateRange().withStartDate(next.startDate())));
        return Stream.concat(postponed, continuation.stream());
    }

    /**
     * Latest iteration already behind us: either started on or before the balance date, or linked to an
     * operation dated on or before it.
     */
    private Optional<LocalDate> latestActualizedIteration(PlannedOperation operation, Set<LocalDate> linked) {
        Stream<LocalDate> started = operation.dateRange().lastDateRange(balanceDate).map(DateSpan::startDate).stream();
        Stream<LocalDate> paidEarly = linked.stream()
                .filter(iterationDate -> !iterationDate.isAfter(balanceDate)
                        || hasLinkedOperationBy(new IterationKey(operation.id(), iterationDate)));
        return Stream.concat(started, paidEarly).max(Comparator.naturalOrder());
    }

    private boolean hasLinkedOperationBy(IterationKey key) {
        return operationsByPlannedIteration.getOrDefault(key, Set.of()).stream()
                .map(operationsById::get)
                .anyMatch(operation -> operation != null && !operation.date().isAfter(balanceDate));
    }

    private Optional<PlannedOperation> advancePast(PlannedOperation operation, LocalDate iterationDate) {
        Optional<PlannedOperation> advanced = operation.dateRange().nextDateRange(iterationDate)
                .map(next -> operation.withDateRange(operation.dateRange().withStartDate(next.startDate())));
        if (advanced.isEmpty()) {
            log.debug("Planned operation {} has no iteration left after {}", operation.id(), iterationDate);
        }
        return advanced;
    }

    private Stream<Budget> actualizeBudget(Budget budget) {
        DateRange range = budget.dateRange();
        if (range.isExpired(balanceDate)) {
            log.debug("Budget {} expired before {}", budget.id(), balanceDate);
            return Stream.empty();
        }
        if (range.isFuture(balanceDate)) {
            return Stream.of(budget);
        }
        Optional<Budget> renewal = range.nextDateRange(balanceDate)
                .map(next -> budget.withDateRange(range.withStartDate(next.startDate())));
        Optional<Budget> remainder = range.currentDateRange(balanceDate).flatMap(current -> remainder(budget, current));
        return Stream.concat(remainder.stream(), renewal.stream());
    }

    /**
     * What is left of the budget in {@code current} after its linked operations, from the day after the balance
     * date to the end of the iteration.
     */
    private Optional<Budget> remainder(Budget budget, DateSpan current) {
        double remaining = budget.amount().value();
        if (budget.id() != null) {
            List<HistoricOperation> linked = operationsByBudgetIteration
                    .getOrDefault(new IterationKey(budget.id(), current.startDate()), Set.of()).stream()
                    .map(operationsById::get)
                    .filter(Objects::nonNull)
                    .sorted(Comparator.comparing(HistoricOperation::date).thenComparingLong(HistoricOperation::id))
                    .toList();
            for (HistoricOperation operation : linked) {
                if (remaining == 0.0) {
                    break;
                }
                double value = operation.amount().value();
                if (value * remaining < 0) {
                    continue;
                }
                double consumed = remaining > 0 ? Math.min(value, remaining) : Math.max(value, remaining);
                remaining -= consumed;
            }
        }
        if (remaining == 0.0) {
            log.debug("Budget {} fully consumed for iteration {}", budget.id(), current.startDate());
            return Optional.empty();
        }
        LocalDate start = balanceDate.plusDays(1);
        if (start.isAfter(current.lastDate())) {
            return Optional.empty();
        }
        Period duration = Period.ofDays((int) ChronoUnit.DAYS.between(start, current.lastDate()) + 1);
        return Optional.of(budget
                .withDateRange(new DateSpan(start, duration))
                .withAmount(new Amount(remaining, budget.amount().currency())));
    }

    private record IterationKey(Long targetId, LocalDate iterationDate) {
    }
}
