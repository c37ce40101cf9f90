package com.safepocket.forecast.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.calendar.RecurringDateRange;
import com.safepocket.forecast.config.ForecastProperties;
import com.safepocket.forecast.link.MatchScorer;
import com.safepocket.forecast.link.MatcherKey;
import com.safepocket.forecast.link.MatcherRegistry;
import com.safepocket.forecast.link.OperationLinkService;
import com.safepocket.forecast.model.Account;
import com.safepocket.forecast.model.Amount;
import com.safepocket.forecast.model.Category;
import com.safepocket.forecast.model.HistoricOperation;
import com.safepocket.forecast.model.LinkType;
import com.safepocket.forecast.model.OperationLink;
import com.safepocket.forecast.operation.InvalidIterationException;
import com.safepocket.forecast.operation.OperationsCategorizer;
import com.safepocket.forecast.operation.PlannedOperation;
import com.safepocket.forecast.repository.InMemoryForecastRepository;
import com.safepocket.forecast.repository.InMemoryOperationLinkRepository;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ForecastServiceLinkingTest {

    private static final LocalDate JANUARY_FIRST = LocalDate.parse("2025-01-01");

    private InMemoryOperationLinkRepository linkRepository;
    private MatcherRegistry matcherRegistry;
    private ForecastService forecastService;
    private PlannedOperation rent;
    private PlannedOperation gym;

    private final HistoricOperation gymFee = new HistoricOperation(7, "Gym card", Amount.of(-30, "EUR"),
            Category.LEISURE, JANUARY_FIRST);

    @BeforeEach
    void setUp() {
        InMemoryForecastRepository forecastRepository = new InMemoryForecastRepository();
        linkRepository = new InMemoryOperationLinkRepository();
        matcherRegistry = new MatcherRegistry();
        ForecastProperties properties = new ForecastProperties(null, null, null);
        OperationLinkService linkService = new OperationLinkService(linkRepository, new MatchScorer(properties));
        TargetService targetService = new TargetService(forecastRepository, linkService, matcherRegistry, properties);
        forecastService = new ForecastService(forecastRepository, linkRepository, linkService, matcherRegistry,
                new OperationsCategorizer());

        rent = targetService.createPlannedOperation("Rent", Amount.of(-900, "EUR"), Category.RENT,
                RecurringDateRange.recurringDay(JANUARY_FIRST, Period.ofMonths(1)));
        gym = targetService.createPlannedOperation("Gym", Amount.of(-30, "EUR"), Category.LEISURE,
                RecurringDateRange.recurringDay(JANUARY_FIRST, Period.ofMonths(1)));
        linkRepository.save(OperationLink.automatic(gymFee.id(), LinkType.PLANNED_OPERATION, rent.id(), JANUARY_FIRST));
        targetService.reloadMatchers();
    }

    @Test
    void manualLinkMovesOperationBetweenRegisteredMatchers() {
        OperationLink link = forecastService.linkManually(gymFee.id(), MatcherKey.of(gym), JANUARY_FIRST, "gym fee");

        assertThat(link.manual()).isTrue();
        assertThat(matcherRegistry.get(MatcherKey.of(rent)).orElseThrow().isLinked(gymFee)).isFalse();
        assertThat(matcherRegistry.get(MatcherKey.of(gym)).orElseThrow().isLinked(gymFee)).isTrue();
    }

    @Test
    void lateIterationsFollowTheManualLink() {
        Account account = new Account("Main", 500, "EUR", LocalDate.parse("2025-01-03"), List.of(gymFee));

        forecastService.linkManually(gymFee.id(), MatcherKey.of(gym), JANUARY_FIRST, null);
        Map<MatcherKey, List<DateSpan>> late = forecastService.lateIterations(account);

        assertThat(late).containsOnlyKeys(MatcherKey.of(rent));
        assertThat(late.get(MatcherKey.of(rent))).containsExactly(DateSpan.singleDay(JANUARY_FIRST));
    }

    @Test
    void unlinkRefreshesPreviousTarget() {
        forecastService.unlink(gymFee.id());

        assertThat(linkRepository.findByOperationId(gymFee.id())).isEmpty();
        assertThat(matcherRegistry.get(MatcherKey.of(rent)).orElseThrow().linkedIterations()).isEmpty();
    }

    @Test
    void invalidManualLinkLeavesLinksAndMatchersUntouched() {
        assertThatThrownBy(() -> forecastService.linkManually(gymFee.id(), MatcherKey.of(gym), LocalDate.parse("2025-01-15"), null))
                .isInstanceOf(InvalidIterationException.class);
        assertThatThrownBy(() -> forecastService.linkManually(gymFee.id(), new MatcherKey(LinkType.BUDGET, 99), JANUARY_FIRST, null))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(linkRepository.findByOperationId(gymFee.id()))
                .hasValueSatisfying(link -> assertThat(link.targetId()).isEqualTo(rent.id()));
        assertThat(matcherRegistry.get(MatcherKey.of(rent)).orElseThrow().isLinked(gymFee)).isTrue();
    }
}
