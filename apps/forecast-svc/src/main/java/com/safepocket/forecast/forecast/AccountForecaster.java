package com.safepocket.forecast.forecast;

import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.model.Account;
import com.safepocket.forecast.model.Amount;
import com.safepocket.forecast.model.HistoricOperation;
import com.safepocket.forecast.operation.OperationRange;
import com.safepocket.forecast.operation.PlannedOperation;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes the state of an account at any date: before its balance date by undoing recorded operations,
 * after it by playing an actualized forecast day by day.
 */
public class AccountForecaster {

    private final Account account;
    private final Forecast forecast;

    public AccountForecaster(Account account, Forecast forecast) {
        this.account = account;
        this.forecast = forecast;
    }

    public Account stateAt(LocalDate date) {
        if (date.equals(account.balanceDate())) {
            return account;
        }
        return date.isBefore(account.balanceDate()) ? pastStateAt(date) : futureStateAt(date);
    }

    private Account pastStateAt(LocalDate date) {
        double balance = account.balance();
        List<HistoricOperation> kept = new ArrayList<>();
        for (HistoricOperation operation : account.operations()) {
            if (operation.date().isAfter(date) && !operation.date().isAfter(account.balanceDate())) {
                balance -= operation.amount().value();
            } else {
                kept.add(operation);
            }
        }
        return account.withState(balance, date, kept);
    }

    private Account futureStateAt(LocalDate date) {
        LocalDate firstDay = account.balanceDate().plusDays(1);
        long nextId = account.operations().stream().mapToLong(HistoricOperation::id).max().orElse(0) + 1;
        List<HistoricOperation> projected = new ArrayList<>();
        Iterator<OperationRange> ranges = forecast.ranges()
                .filter(range -> !(range instanceof PlannedOperation planned && planned.archived()))
                .iterator();
        while (ranges.hasNext()) {
            OperationRange range = ranges.next();
            Iterator<DateSpan> iterations = range.dateRange().iterate(firstDay).iterator();
            while (iterations.hasNext()) {
                DateSpan iteration = iterations.next();
                if (iteration.isFuture(date)) {
                    break;
                }
                if (iteration.isExpired(firstDay)) {
                    continue;
                }
                Amount daily = range.amount().times(1.0 / iteration.totalDays());
                LocalDate day = iteration.startDate().isBefore(firstDay) ? firstDay : iteration.startDate();
                LocalDate last = iteration.lastDate().isBefore(date) ? iteration.lastDate() : date;
                for (; !day.isAfter(last); day = day.plusDays(1)) {
                    projected.add(new HistoricOperation(nextId++, range.description(), daily, range.category(), day));
                }
            }
        }
        double balance = account.balance() + projected.stream().mapToDouble(operation -> operation.amount().value()).sum();
        List<HistoricOperation> operations = new ArrayList<>(account.operations());
        operations.addAll(projected);
        operations.sort(Comparator.comparing(HistoricOperation::date));
        return account.withState(balance, date, operations);
    }

    /**
     * Daily end-of-day balances from {@code from} to {@code to}, both included.
     */
    public List<BalancePoint> balanceEvolution(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        Account horizon = to.isAfter(account.balanceDate()) ? stateAt(to) : account;
        Map<LocalDate, Double> totalsByDay = new TreeMap<>();
        for (HistoricOperation operation : horizon.operations()) {
            totalsByDay.merge(operation.date(), operation.amount().value(), Double::sum);
        }
        List<BalancePoint> points = new ArrayList<>();
        double balance = horizon.balance();
        for (LocalDate day = horizon.balanceDate(); !day.isBefore(from); day = day.minusDays(1)) {
            if (!day.isAfter(to)) {
                points.add(new BalancePoint(day, balance));
            }
            balance -= totalsByDay.getOrDefault(day, 0.0);
        }
        Collections.reverse(points);
        return points;
    }
}
