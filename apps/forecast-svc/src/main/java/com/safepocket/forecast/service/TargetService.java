package com.safepocket.forecast.service;

import com.safepocket.forecast.calendar.DateRange;
import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.calendar.RecurringDateRange;
import com.safepocket.forecast.calendar.Split;
import com.safepocket.forecast.config.ForecastProperties;
import com.safepocket.forecast.link.MatcherKey;
import com.safepocket.forecast.link.MatcherRegistry;
import com.safepocket.forecast.link.OperationLinkService;
import com.safepocket.forecast.model.Amount;
import com.safepocket.forecast.model.Category;
import com.safepocket.forecast.model.HistoricOperation;
import com.safepocket.forecast.model.LinkType;
import com.safepocket.forecast.model.OperationLink;
import com.safepocket.forecast.operation.Budget;
import com.safepocket.forecast.operation.InvalidIterationException;
import com.safepocket.forecast.operation.OperationRange;
import com.safepocket.forecast.operation.PlannedOperation;
import com.safepocket.forecast.repository.ForecastRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Lifecycle of planned operations and budgets. Every change is mirrored in the stored links and in the
 * {@link MatcherRegistry}.
 */
@Service
public class TargetService {

    private static final Logger log = LoggerFactory.getLogger(TargetService.class);

    private final ForecastRepository forecastRepository;
    private final OperationLinkService linkService;
    private final MatcherRegistry matcherRegistry;
    private final ForecastProperties properties;
    private final Clock clock;

    @Autowired
    public TargetService(ForecastRepository forecastRepository,
                         OperationLinkService linkService,
                         MatcherRegistry matcherRegistry,
                         ForecastProperties properties) {
        this(forecastRepository, linkService, matcherRegistry, properties, Clock.systemDefaultZone());
    }

    TargetService(ForecastRepository forecastRepository,
                  OperationLinkService linkService,
                  MatcherRegistry matcherRegistry,
                  ForecastProperties properties,
                  Clock clock) {
        this.forecastRepository = forecastRepository;
        this.linkService = linkService;
        this.matcherRegistry = matcherRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates a planned operation matched with the configured default criteria.
     */
    public PlannedOperation createPlannedOperation(String description, Amount amount, Category category, DateRange dateRange) {
        PlannedOperation operation = new PlannedOperation(
                null, description, amount, category, dateRange, properties.plannedOperation().defaultCriteria(), false);
        return addPlannedOperation(operation);
    }

    public PlannedOperation addPlannedOperation(PlannedOperation operation) {
        PlannedOperation saved = forecastRepository.savePlannedOperation(operation);
        matcherRegistry.put(linkService.matcherFor(saved));
        log.info("Planned operation {} '{}' added", saved.id(), saved.description());
        return saved;
    }

    /**
     * Stores new values for an existing operation. Links that no longer fall on an iteration start are dropped,
     * heuristic links are recomputed against {@code operations}.
     */
    public PlannedOperation updatePlannedOperation(PlannedOperation operation, Collection<HistoricOperation> operations) {
        PlannedOperation previous = requirePlannedOperation(operation.id());
        PlannedOperation saved = forecastRepository.savePlannedOperation(operation);
        refreshLinks(previous, saved, operations);
        log.info("Planned operation {} '{}' updated", saved.id(), saved.description());
        return saved;
    }

    public void deletePlannedOperation(long id) {
        if (!forecastRepository.deletePlannedOperation(id)) {
            throw new IllegalArgumentException("Planned operation " + id + " not found");
        }
        int links = linkService.deleteLinksForTarget(LinkType.PLANNED_OPERATION, id);
        matcherRegistry.remove(new MatcherKey(LinkType.PLANNED_OPERATION, id));
        log.info("Planned operation {} deleted with {} link(s)", id, links);
    }

    /**
     * Ends the operation before {@code splitDate} and continues it from there with the given changes.
     * Heuristic links that would not fall on an iteration of the continuation are dropped.
     *
     * @param newAmount amount of the continuation, or {@code null} to keep the current one
     * @param newPeriod period of the continuation, or {@code null} to keep the current one
     * @return the persisted continuation
     * @throws InvalidIterationException when a manual link would not fall on an iteration of the continuation
     */
    public PlannedOperation splitPlannedOperation(long id, LocalDate splitDate, Amount newAmount, Period newPeriod) {
        PlannedOperation original = requirePlannedOperation(id);
        Split<PlannedOperation> split = original.splitAt(splitDate);
        PlannedOperation continuation = split.continuation();
        if (newAmount != null) {
            continuation = continuation.withAmount(newAmount);
        }
        if (newPeriod != null) {
            continuation = continuation.withDateRange(((RecurringDateRange) continuation.dateRange()).withPeriod(newPeriod));
        }
        dropLinksOffContinuationGrid(original, continuation, splitDate);
        PlannedOperation terminated = forecastRepository.savePlannedOperation(split.terminated());
        PlannedOperation saved = forecastRepository.savePlannedOperation(continuation);
        int migrated = linkService.migrateLinksAfterSplit(LinkType.PLANNED_OPERATION, id, saved.id(), splitDate);
        matcherRegistry.put(linkService.matcherFor(terminated));
        matcherRegistry.put(linkService.matcherFor(saved));
        log.info("Split planned operation {} at {}, created planned operation {} ({} link(s) migrated)",
                id, splitDate, saved.id(), migrated);
        return saved;
    }

    public Budget createBudget(String description, Amount amount, Category category, DateRange dateRange) {
        Budget budget = new Budget(null, description, amount, category, dateRange, properties.budget().defaultCriteria());
        return addBudget(budget);
    }

    public Budget addBudget(Budget budget) {
        Budget saved = forecastRepository.saveBudget(budget);
        matcherRegistry.put(linkService.matcherFor(saved));
        log.info("Budget {} '{}' added", saved.id(), saved.description());
        return saved;
    }

    public Budget updateBudget(Budget budget, Collection<HistoricOperation> operations) {
        Budget previous = requireBudget(budget.id());
        Budget saved = forecastRepository.saveBudget(budget);
        refreshLinks(previous, saved, operations);
        log.info("Budget {} '{}' updated", saved.id(), saved.description());
        return saved;
    }

    public void deleteBudget(long id) {
        if (!forecastRepository.deleteBudget(id)) {
            throw new IllegalArgumentException("Budget " + id + " not found");
        }
        int links = linkService.deleteLinksForTarget(LinkType.BUDGET, id);
        matcherRegistry.remove(new MatcherKey(LinkType.BUDGET, id));
        log.info("Budget {} deleted with {} link(s)", id, links);
    }

    /**
     * @param newAmount   amount of the continuation, or {@code null} to keep the current one
     * @param newPeriod   period of the continuation, or {@code null} to keep the current one
     * @param newDuration duration of each continuation iteration, or {@code null} to keep the current one
     * @return the persisted continuation
     * @throws InvalidIterationException when a manual link would not fall on an iteration of the continuation
     */
    public Budget splitBudget(long id, LocalDate splitDate, Amount newAmount, Period newPeriod, Period newDuration) {
        Budget original = requireBudget(id);
        Split<Budget> split = original.splitAt(splitDate);
        Budget continuation = split.continuation();
        RecurringDateRange range = (RecurringDateRange) continuation.dateRange();
        if (newPeriod != null) {
            range = range.withPeriod(newPeriod);
        }
        if (newDuration != null) {
            range = range.withDuration(newDuration);
        }
        continuation = continuation.withDateRange(range);
        if (newAmount != null) {
            continuation = continuation.withAmount(newAmount);
        }
        dropLinksOffContinuationGrid(original, continuation, splitDate);
        Budget terminated = forecastRepository.saveBudget(split.terminated());
        Budget saved = forecastRepository.saveBudget(continuation);
        int migrated = linkService.migrateLinksAfterSplit(LinkType.BUDGET, id, saved.id(), splitDate);
        matcherRegistry.put(linkService.matcherFor(terminated));
        matcherRegistry.put(linkService.matcherFor(saved));
        log.info("Split budget {} at {}, created budget {} ({} link(s) migrated)", id, splitDate, saved.id(), migrated);
        return saved;
    }

    /**
     * Start of the first iteration no operation is linked to, beginning with the iteration in progress today,
     * which may have started before today. Empty for targets that do not recur.
     */
    public Optional<LocalDate> nextUnlinkedIteration(LinkType type, long id) {
        OperationRange target = type == LinkType.PLANNED_OPERATION ? requirePlannedOperation(id) : requireBudget(id);
        if (!(target.dateRange() instanceof RecurringDateRange range)) {
            return Optional.empty();
        }
        Set<LocalDate> linked = linkService.linksFor(target).stream()
                .map(OperationLink::iterationDate)
                .collect(Collectors.toSet());
        return range.iterate(LocalDate.now(clock))
                .map(DateSpan::startDate)
                .filter(start -> !linked.contains(start))
                .findFirst();
    }

    /**
     * Rebuilds the registry from the repository.
     */
    public void reloadMatchers() {
        matcherRegistry.clear();
        forecastRepository.findPlannedOperations().forEach(operation -> matcherRegistry.put(linkService.matcherFor(operation)));
        forecastRepository.findBudgets().forEach(budget -> matcherRegistry.put(linkService.matcherFor(budget)));
        log.debug("Matcher registry reloaded with {} matcher(s)", matcherRegistry.snapshot().size());
    }

    private void refreshLinks(OperationRange previous, OperationRange saved, Collection<HistoricOperation> operations) {
        if (!previous.dateRange().equals(saved.dateRange())) {
            for (OperationLink link : linkService.linksFor(saved)) {
                if (!isIterationStart(saved, link.iterationDate())) {
                    linkService.deleteLink(link.operationId());
                    log.info("Link of operation {} dropped: {} is no longer an iteration of {} {}",
                            link.operationId(), link.iterationDate(), saved.linkType(), saved.id());
                }
            }
        }
        linkService.recalculateLinks(saved, operations);
        matcherRegistry.put(linkService.matcherFor(saved));
    }

    /**
     * Checks the links the split would migrate before anything is written.
     */
    private void dropLinksOffContinuationGrid(OperationRange original, OperationRange continuation, LocalDate splitDate) {
        List<OperationLink> offGrid = linkService.linksFor(original).stream()
                .filter(link -> !link.iterationDate().isBefore(splitDate))
                .filter(link -> !isIterationStart(continuation, link.iterationDate()))
                .toList();
        for (OperationLink link : offGrid) {
            if (link.manual()) {
                throw new InvalidIterationException(link.iterationDate(),
                        "the continuation of '" + original.description() + "' (manual link of operation " + link.operationId() + ")");
            }
        }
        for (OperationLink link : offGrid) {
            linkService.deleteLink(link.operationId());
            log.info("Link of operation {} dropped: {} is not an iteration of the continuation of {} {}",
                    link.operationId(), link.iterationDate(), original.linkType(), original.id());
        }
    }

    private static boolean isIterationStart(OperationRange range, LocalDate date) {
        return range.dateRange().currentDateRange(date)
                .map(iteration -> iteration.startDate().equals(date))
                .orElse(false);
    }

    private PlannedOperation requirePlannedOperation(Long id) {
        if (id == null) {
            throw new IllegalArgumentException("Planned operation has not been saved");
        }
        return forecastRepository.findPlannedOperation(id)
                .orElseThrow(() -> new IllegalArgumentException("Planned operation " + id + " not found"));
    }

    private Budget requireBudget(Long id) {
        if (id == null) {
            throw new IllegalArgumentException("Budget has not been saved");
        }
        return forecastRepository.findBudget(id)
                .orElseThrow(() -> new IllegalArgumentException("Budget " + id + " not found"));
    }
}
