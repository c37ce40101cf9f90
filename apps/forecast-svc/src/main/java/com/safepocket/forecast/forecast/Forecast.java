package com.safepocket.forecast.forecast;

import com.safepocket.forecast.operation.Budget;
import com.safepocket.forecast.operation.OperationRange;
import com.safepocket.forecast.operation.PlannedOperation;
import java.util.List;
import java.util.stream.Stream;

public record Forecast(List<PlannedOperation> operations, List<Budget> budgets) {

    public Forecast {
        operations = operations == null ? List.of() : List.copyOf(operations);
        budgets = budgets == null ? List.of() : List.copyOf(budgets);
    }

    public static Forecast empty() {
        return new Forecast(List.of(), List.of());
    }

    public Stream<OperationRange> ranges() {
        return Stream.concat(operations.stream(), budgets.stream());
    }
}
