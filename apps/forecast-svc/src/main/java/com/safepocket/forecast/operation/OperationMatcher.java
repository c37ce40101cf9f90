package com.safepocket.forecast.operation;

import com.safepocket.forecast.calendar.DateRange;
import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.calendar.DateTolerance;
import com.safepocket.forecast.model.HistoricOperation;
import com.safepocket.forecast.model.OperationLink;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which historic operations belong to an {@link OperationRange}.
 * <p>
 * An operation linked to the range always matches, on the linked iteration. Other operations match
 * heuristically on category, amount, description hints and date, using the range's {@link MatchCriteria}.
 */
public final class OperationMatcher {

    private final OperationRange operationRange;
    private final Map<Long, LocalDate> linkedIterations;

    public OperationMatcher(OperationRange operationRange) {
        this(operationRange, List.of());
    }

    /**
     * @throws InvalidIterationException when a link does not point at an iteration start of the range
     */
    public OperationMatcher(OperationRange operationRange, Collection<OperationLink> links) {
        if (operationRange == null) {
            throw new IllegalArgumentException("operationRange must be provided");
        }
        this.operationRange = operationRange;
        Map<Long, LocalDate> iterations = new HashMap<>();
        for (OperationLink link : links) {
            if (operationRange.id() == null || !link.targets(operationRange.linkType(), operationRange.id())) {
                throw new IllegalArgumentException("link of operation " + link.operationId() + " targets another range");
            }
            requireIterationStart(link.iterationDate());
            iterations.put(link.operationId(), link.iterationDate());
        }
        this.linkedIterations = Collections.unmodifiableMap(iterations);
    }

    private OperationMatcher(OperationRange operationRange, Map<Long, LocalDate> linkedIterations) {
        this.operationRange = operationRange;
        this.linkedIterations = linkedIterations;
    }

    /**
     * @throws InvalidIterationException when {@code iterationDate} is not an iteration start of the range
     */
    public void requireIterationStart(LocalDate iterationDate) {
        boolean onGrid = operationRange.dateRange().currentDateRange(iterationDate)
                .map(iteration -> iteration.startDate().equals(iterationDate))
                .orElse(false);
        if (!onGrid) {
            throw new InvalidIterationException(iterationDate, "'" + operationRange.description() + "'");
        }
    }

    public OperationRange operationRange() {
        return operationRange;
    }

    public MatchCriteria criteria() {
        return operationRange.criteria();
    }

    public Map<Long, LocalDate> linkedIterations() {
        return linkedIterations;
    }

    /**
     * Links only make sense on the iteration grid they were created for, so they are kept only when the range
     * is unchanged.
     */
    public OperationMatcher withOperationRange(OperationRange newRange) {
        if (newRange.equals(operationRange)) {
            return this;
        }
        return new OperationMatcher(newRange, Map.of());
    }

    public OperationMatcher withLinks(Collection<OperationLink> links) {
        return new OperationMatcher(operationRange, links);
    }

    public boolean isLinked(HistoricOperation operation) {
        return linkedIterations.containsKey(operation.id());
    }

    public boolean matches(HistoricOperation operation) {
        return isLinked(operation) || matchesHeuristically(operation);
    }

    public boolean matchesHeuristically(HistoricOperation operation) {
        if (isOutOfRange(operation)) {
            return false;
        }
        return matchesCategory(operation)
                && matchesAmount(operation)
                && (criteria().descriptionHints().isEmpty() || matchesDescription(operation))
                && matchesDateRange(operation);
    }

    public boolean matchesCategory(HistoricOperation operation) {
        return operation.category() == operationRange.category();
    }

    public boolean matchesAmount(HistoricOperation operation) {
        return criteria().amountTolerance().accepts(operation.amount().value(), operationRange.amount().value());
    }

    /**
     * True when the description contains at least one hint, ignoring case. Never true without hints.
     */
    public boolean matchesDescription(HistoricOperation operation) {
        String description = operation.description().toLowerCase(Locale.ROOT);
        return criteria().descriptionHints().stream().anyMatch(description::contains);
    }

    public boolean matchesDateRange(HistoricOperation operation) {
        return operationRange.dateRange().isWithin(operation.date(), criteria().dateTolerance());
    }

    private boolean isOutOfRange(HistoricOperation operation) {
        DateRange range = operationRange.dateRange();
        DateTolerance tolerance = criteria().dateTolerance();
        return operation.date().isBefore(tolerance.widenStart(range.startDate()))
                || operation.date().isAfter(tolerance.widenEnd(range.lastDate()));
    }

    /**
     * Start of the iteration the operation belongs to: the linked one if any, otherwise the first iteration
     * whose widened window contains the operation date.
     */
    public Optional<LocalDate> iterationFor(HistoricOperation operation) {
        LocalDate linked = linkedIterations.get(operation.id());
        if (linked != null) {
            return Optional.of(linked);
        }
        if (!matchesHeuristically(operation)) {
            return Optional.empty();
        }
        return operationRange.dateRange()
                .currentDateRange(operation.date(), criteria().dateTolerance())
                .map(DateSpan::startDate);
    }

    public List<HistoricOperation> matches(Collection<HistoricOperation> operations) {
        return operations.stream()
                .filter(this::matches)
                .toList();
    }

    /**
     * Matching operations dated at most {@code daysAfter} days before {@code date}, and not after it.
     */
    public List<HistoricOperation> latestMatchingOperations(LocalDate date, Collection<HistoricOperation> operations) {
        int daysAfter = criteria().dateTolerance().daysAfter();
        return matches(operations).stream()
                .filter(operation -> !operation.date().isAfter(date))
                .filter(operation -> !operation.date().plusDays(daysAfter).isBefore(date))
                .toList();
    }

    /**
     * Iterations already due at {@code date}, still inside their late window, with no matching operation.
     * Each operation explains at most one iteration.
     */
    public List<DateSpan> lateDateRanges(LocalDate date, Collection<HistoricOperation> operations) {
        DateTolerance tolerance = criteria().dateTolerance();
        List<HistoricOperation> unassigned = new ArrayList<>(matches(operations));
        List<DateSpan> late = new ArrayList<>();
        Iterator<DateSpan> iterations = operationRange.dateRange().iterate(date.minusDays(tolerance.daysAfter())).iterator();
        while (iterations.hasNext()) {
            DateSpan iteration = iterations.next();
            if (iteration.isFuture(date)) {
                break;
            }
            if (date.isAfter(tolerance.widenEnd(iteration.lastDate()))) {
                continue;
            }
            Optional<HistoricOperation> explaining = unassigned.stream()
                    .filter(operation -> explains(operation, iteration, tolerance))
                    .findFirst();
            if (explaining.isPresent()) {
                unassigned.remove(explaining.get());
            } else {
                late.add(iteration);
            }
        }
        return late;
    }

    private boolean explains(HistoricOperation operation, DateSpan iteration, DateTolerance tolerance) {
        LocalDate linked = linkedIterations.get(operation.id());
        if (linked != null) {
            return linked.equals(iteration.startDate());
        }
        return iteration.isWithin(operation.date(), tolerance);
    }

    /**
     * Future iterations whose early window is open at {@code date} and already holds a recent matching operation.
     */
    public List<AnticipatedIteration> anticipatedDateRanges(LocalDate date, Collection<HistoricOperation> operations) {
        DateTolerance tolerance = criteria().dateTolerance();
        List<HistoricOperation> recent = new ArrayList<>(latestMatchingOperations(date, operations));
        List<AnticipatedIteration> anticipated = new ArrayList<>();
        Iterator<DateSpan> iterations = operationRange.dateRange().iterate(date.minusDays(tolerance.daysAfter())).iterator();
        while (iterations.hasNext()) {
            DateSpan iteration = iterations.next();
            if (!iteration.isFuture(date)) {
                continue;
            }
            DateSpan earlyWindow = DateSpan.between(tolerance.widenStart(iteration.startDate()), iteration.lastDate());
            if (!earlyWindow.isWithin(date)) {
                break;
            }
            Optional<HistoricOperation> early = recent.stream()
                    .filter(operation -> earlyWindow.isWithin(operation.date()))
                    .findFirst();
            if (early.isPresent()) {
                anticipated.add(new AnticipatedIteration(iteration, early.get()));
                recent.remove(early.get());
            }
        }
        return anticipated;
    }
}
