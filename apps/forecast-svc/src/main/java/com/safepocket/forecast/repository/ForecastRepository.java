package com.safepocket.forecast.repository;

import com.safepocket.forecast.operation.Budget;
import com.safepocket.forecast.operation.PlannedOperation;
import java.util.List;
import java.util.Optional;

public interface ForecastRepository {

    List<PlannedOperation> findPlannedOperations();

    Optional<PlannedOperation> findPlannedOperation(long id);

    /**
     * Stores the operation, assigning an id when it has none.
     */
    PlannedOperation savePlannedOperation(PlannedOperation operation);

    boolean deletePlannedOperation(long id);

    List<Budget> findBudgets();

    Optional<Budget> findBudget(long id);

    /**
     * Stores the budget, assigning an id when it has none.
     */
    Budget saveBudget(Budget budget);

    boolean deleteBudget(long id);
}
