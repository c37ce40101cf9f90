package com.safepocket.forecast.repository;

import com.safepocket.forecast.operation.Budget;
import com.safepocket.forecast.operation.PlannedOperation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryForecastRepository implements ForecastRepository {

    private final Map<Long, PlannedOperation> plannedOperations = new ConcurrentHashMap<>();
    private final Map<Long, Budget> budgets = new ConcurrentHashMap<>();
    private final AtomicLong plannedOperationIds = new AtomicLong();
    private final AtomicLong budgetIds = new AtomicLong();

    @Override
    public List<PlannedOperation> findPlannedOperations() {
        return plannedOperations.values().stream()
                .sorted(Comparator.comparing(PlannedOperation::id))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Optional<PlannedOperation> findPlannedOperation(long id) {
        return Optional.ofNullable(plannedOperations.get(id));
    }

    @Override
    public PlannedOperation savePlannedOperation(PlannedOperation operation) {
        PlannedOperation stored = operation.id() == null
                ? operation.withId(plannedOperationIds.incrementAndGet())
                : operation;
        plannedOperationIds.accumulateAndGet(stored.id(), Math::max);
        plannedOperations.put(stored.id(), stored);
        return stored;
    }

    @Override
    public boolean deletePlannedOperation(long id) {
        return plannedOperations.remove(id) != null;
    }

    @Override
    public List<Budget> findBudgets() {
        return budgets.values().stream()
                .sorted(Comparator.comparing(Budget::id))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Optional<Budget> findBudget(long id) {
        return Optional.ofNullable(budgets.get(id));
    }

    @Override
    public Budget saveBudget(Budget budget) {
        Budget stored = budget.id() == null
                ? budget.withId(budgetIds.incrementAndGet())
                : budget;
        budgetIds.accumulateAndGet(stored.id(), Math::max);
        budgets.put(stored.id(), stored);
        return stored;
    }

    @Override
    public boolean deleteBudget(long id) {
        return budgets.remove(id) != null;
    }
}
