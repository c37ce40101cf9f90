package com.safepocket.forecast.service;

import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.forecast.AccountForecaster;
import com.safepocket.forecast.forecast.BalancePoint;
import com.safepocket.forecast.forecast.Forecast;
import com.safepocket.forecast.forecast.ForecastActualizer;
import com.safepocket.forecast.link.MatcherKey;
import com.safepocket.forecast.link.MatcherRegistry;
import com.safepocket.forecast.link.OperationLinkService;
import com.safepocket.forecast.model.Account;
import com.safepocket.forecast.model.OperationLink;
import com.safepocket.forecast.operation.InvalidIterationException;
import com.safepocket.forecast.operation.OperationMatcher;
import com.safepocket.forecast.operation.OperationsCategorizer;
import com.safepocket.forecast.repository.ForecastRepository;
import com.safepocket.forecast.repository.OperationLinkRepository;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reconciles the stored forecast with an account snapshot and projects the account from it.
 */
@Service
public class ForecastService {

    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    private final ForecastRepository forecastRepository;
    private final OperationLinkRepository linkRepository;
    private final OperationLinkService linkService;
    private final MatcherRegistry matcherRegistry;
    private final OperationsCategorizer categorizer;

    public ForecastService(ForecastRepository forecastRepository,
                           OperationLinkRepository linkRepository,
                           OperationLinkService linkService,
                           MatcherRegistry matcherRegistry,
                           OperationsCategorizer categorizer) {
        this.forecastRepository = forecastRepository;
        this.linkRepository = linkRepository;
        this.linkService = linkService;
        this.matcherRegistry = matcherRegistry;
        this.categorizer = categorizer;
    }

    public Forecast forecast() {
        return new Forecast(forecastRepository.findPlannedOperations(), forecastRepository.findBudgets());
    }

    /**
     * The stored forecast moved to the account's balance date. Nothing is persisted.
     */
    public Forecast actualizedForecast(Account account) {
        return new ForecastActualizer(account, linkRepository.findAll()).actualize(forecast());
    }

    public Account stateAt(Account account, LocalDate date) {
        return new AccountForecaster(account, actualizedForecast(account)).stateAt(date);
    }

    public List<BalancePoint> balanceEvolution(Account account, LocalDate from, LocalDate to) {
        return new AccountForecaster(account, actualizedForecast(account)).balanceEvolution(from, to);
    }

    /**
     * Gives uncategorized operations the category of the planned operation they look like.
     */
    public Account categorize(Account account) {
        return account.withOperations(categorizer.categorize(account.operations(), forecastRepository.findPlannedOperations()));
    }

    /**
     * Links the account's unlinked operations to their best matching target and refreshes the matchers of
     * every target that gained links.
     */
    public List<OperationLink> linkOperations(Account account) {
        List<OperationLink> created = linkService.createHeuristicLinks(account.operations(), matcherRegistry.snapshot());
        created.stream()
                .map(ForecastService::targetOf)
                .distinct()
                .forEach(this::refreshMatcher);
        log.info("Linked {} of {} operation(s) of account '{}'", created.size(), account.operations().size(), account.name());
        return created;
    }

    /**
     * Links an operation to an iteration of a registered target, replacing any link it had. The matchers of
     * the previous and the new target are refreshed.
     *
     * @throws IllegalArgumentException  when no matcher is registered for {@code target}
     * @throws InvalidIterationException when {@code iterationDate} is not an iteration start of the target
     */
    public OperationLink linkManually(long operationId, MatcherKey target, LocalDate iterationDate, String notes) {
        OperationMatcher matcher = matcherRegistry.get(target)
                .orElseThrow(() -> new IllegalArgumentException(target.type() + " " + target.targetId() + " not found"));
        Optional<OperationLink> previous = linkRepository.findByOperationId(operationId);
        OperationLink link = linkService.createManualLink(operationId, matcher.operationRange(), iterationDate, notes);
        previous.map(ForecastService::targetOf)
                .filter(key -> !key.equals(target))
                .ifPresent(this::refreshMatcher);
        refreshMatcher(target);
        return link;
    }

    public void unlink(long operationId) {
        Optional<OperationLink> previous = linkRepository.findByOperationId(operationId);
        linkService.deleteLink(operationId);
        previous.map(ForecastService::targetOf).ifPresent(this::refreshMatcher);
        previous.ifPresent(link -> log.info("Operation {} unlinked from {} {}", operationId, link.targetType(), link.targetId()));
    }

    private void refreshMatcher(MatcherKey key) {
        matcherRegistry.get(key)
                .map(matcher -> linkService.matcherFor(matcher.operationRange()))
                .ifPresent(matcherRegistry::put);
    }

    private static MatcherKey targetOf(OperationLink link) {
        return new MatcherKey(link.targetType(), link.targetId());
    }

    /**
     * Iterations due at the balance date that no operation explains, per target.
     */
    public Map<MatcherKey, List<DateSpan>> lateIterations(Account account) {
        Map<MatcherKey, List<DateSpan>> late = new LinkedHashMap<>();
        for (Map.Entry<MatcherKey, OperationMatcher> entry : matcherRegistry.snapshot().entrySet()) {
            List<DateSpan> iterations = entry.getValue().lateDateRanges(account.balanceDate(), account.operations());
            if (!iterations.isEmpty()) {
                late.put(entry.getKey(), iterations);
            }
        }
        return late;
    }
}
