package com.safepocket.forecast.operation;

import com.safepocket.forecast.model.Category;
import com.safepocket.forecast.model.HistoricOperation;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Gives uncategorized operations the category of the first planned operation whose description hints,
 * amount and dates they match.
 */
@Component
public class OperationsCategorizer {

    private static final Logger log = LoggerFactory.getLogger(OperationsCategorizer.class);

    public List<HistoricOperation> categorize(Collection<HistoricOperation> operations,
                                              Collection<PlannedOperation> plannedOperations) {
        List<OperationMatcher> matchers = plannedOperations.stream()
                .filter(planned -> !planned.archived())
                .map(OperationMatcher::new)
                .toList();
        return operations.stream()
                .map(operation -> categorize(operation, matchers))
                .toList();
    }

    private HistoricOperation categorize(HistoricOperation operation, List<OperationMatcher> matchers) {
        if (operation.category() != Category.UNCATEGORIZED) {
            return operation;
        }
        Optional<OperationMatcher> matcher = matchers.stream()
                .filter(candidate -> candidate.matchesDescription(operation)
                        && candidate.matchesAmount(operation)
                        && candidate.matchesDateRange(operation))
                .findFirst();
        if (matcher.isEmpty()) {
            return operation;
        }
        Category category = matcher.get().operationRange().category();
        log.debug("Operation {} categorized as {} from '{}'", operation.id(), category, matcher.get().operationRange().description());
        return operation.withCategory(category);
    }
}
