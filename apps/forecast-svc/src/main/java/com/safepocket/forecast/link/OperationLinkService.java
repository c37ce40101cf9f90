package com.safepocket.forecast.link;

import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.model.HistoricOperation;
import com.safepocket.forecast.model.LinkType;
import com.safepocket.forecast.model.OperationLink;
import com.safepocket.forecast.operation.InvalidIterationException;
import com.safepocket.forecast.operation.OperationMatcher;
import com.safepocket.forecast.operation.OperationRange;
import com.safepocket.forecast.repository.OperationLinkRepository;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps operation links in step with planned operations and budgets. Heuristic links are recreated freely,
 * manual links are only changed on explicit request.
 */
@Service
public class OperationLinkService {

    private static final Logger log = LoggerFactory.getLogger(OperationLinkService.class);

    private final OperationLinkRepository repository;
    private final MatchScorer scorer;

    public OperationLinkService(OperationLinkRepository repository, MatchScorer scorer) {
        this.repository = repository;
        this.scorer = scorer;
    }

    public List<OperationLink> linksFor(OperationRange range) {
        if (range.id() == null) {
            return List.of();
        }
        return repository.findByTarget(range.linkType(), range.id());
    }

    public OperationMatcher matcherFor(OperationRange range) {
        return new OperationMatcher(range, linksFor(range));
    }

    /**
     * Links every operation that has no link yet to the best scoring target whose matcher accepts it.
     */
    public List<OperationLink> createHeuristicLinks(Collection<HistoricOperation> operations,
                                                    Map<MatcherKey, OperationMatcher> matchers) {
        List<OperationLink> created = new ArrayList<>();
        for (HistoricOperation operation : operations) {
            if (repository.findByOperationId(operation.id()).isPresent()) {
                continue;
            }
            Candidate best = null;
            for (Map.Entry<MatcherKey, OperationMatcher> entry : matchers.entrySet()) {
                Optional<Candidate> candidate = candidate(operation, entry.getKey(), entry.getValue());
                if (candidate.isPresent() && (best == null || candidate.get().score() > best.score())) {
                    best = candidate.get();
                }
            }
            if (best != null) {
                OperationLink link = OperationLink.automatic(
                        operation.id(), best.key().type(), best.key().targetId(), best.iterationDate());
                repository.save(link);
                created.add(link);
            }
        }
        if (!created.isEmpty()) {
            log.debug("Created {} heuristic link(s) for {} operation(s)", created.size(), operations.size());
        }
        return created;
    }

    private Optional<Candidate> candidate(HistoricOperation operation, MatcherKey key, OperationMatcher matcher) {
        if (!matcher.matchesHeuristically(operation)) {
            return Optional.empty();
        }
        OperationRange range = matcher.operationRange();
        return range.dateRange()
                .currentDateRange(operation.date(), matcher.criteria().dateTolerance())
                .map(DateSpan::startDate)
                .map(iterationDate -> new Candidate(key, iterationDate, scorer.score(operation, range, iterationDate)));
    }

    /**
     * Replaces the target's heuristic links with freshly computed ones. Manual links are left alone.
     */
    public List<OperationLink> recalculateLinks(OperationRange target, Collection<HistoricOperation> operations) {
        if (target.id() == null) {
            return List.of();
        }
        int removed = repository.deleteAutomaticByTarget(target.linkType(), target.id());
        List<OperationLink> created = createHeuristicLinks(operations, Map.of(MatcherKey.of(target), matcherFor(target)));
        log.debug("Recalculated links of {} {}: {} removed, {} created",
                target.linkType(), target.id(), removed, created.size());
        return created;
    }

    /**
     * @throws InvalidIterationException when {@code iterationDate} is not an iteration start of the target
     */
    public OperationLink createManualLink(long operationId, OperationRange target, LocalDate iterationDate, String notes) {
        if (target.id() == null) {
            throw new IllegalArgumentException("cannot link to an unsaved " + target.linkType());
        }
        new OperationMatcher(target).requireIterationStart(iterationDate);
        OperationLink link = OperationLink.manual(operationId, target.linkType(), target.id(), iterationDate, notes);
        log.info("Operation {} manually linked to {} {} on {}", operationId, target.linkType(), target.id(), iterationDate);
        return repository.save(link);
    }

    public void deleteLink(long operationId) {
        repository.deleteByOperationId(operationId);
    }

    public int deleteLinksForTarget(LinkType type, long targetId) {
        return repository.deleteByTarget(type, targetId);
    }

    /**
     * Moves the links of iterations on or after {@code splitDate} from the terminated target to its continuation.
     */
    public int migrateLinksAfterSplit(LinkType type, long terminatedId, long continuationId, LocalDate splitDate) {
        int migrated = 0;
        for (OperationLink link : repository.findByTarget(type, terminatedId)) {
            if (!link.iterationDate().isBefore(splitDate)) {
                repository.save(link.withTargetId(continuationId));
                migrated++;
            }
        }
        return migrated;
    }

    private record Candidate(MatcherKey key, LocalDate iterationDate, double score) {
    }
}
