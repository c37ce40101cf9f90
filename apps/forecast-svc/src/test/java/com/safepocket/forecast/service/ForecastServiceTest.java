package com.safepocket.forecast.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.calendar.RecurringDateRange;
import com.safepocket.forecast.forecast.Forecast;
import com.safepocket.forecast.link.MatcherKey;
import com.safepocket.forecast.link.MatcherRegistry;
import com.safepocket.forecast.link.OperationLinkService;
import com.safepocket.forecast.model.Account;
import com.safepocket.forecast.model.Amount;
import com.safepocket.forecast.model.Category;
import com.safepocket.forecast.model.HistoricOperation;
import com.safepocket.forecast.model.LinkType;
import com.safepocket.forecast.model.OperationLink;
import com.safepocket.forecast.operation.OperationMatcher;
import com.safepocket.forecast.operation.OperationsCategorizer;
import com.safepocket.forecast.operation.PlannedOperation;
import com.safepocket.forecast.repository.ForecastRepository;
import com.safepocket.forecast.repository.OperationLinkRepository;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ForecastServiceTest {

    @Mock
    ForecastRepository forecastRepository;
    @Mock
    OperationLinkRepository linkRepository;
    @Mock
    OperationLinkService linkService;
    @Mock
    MatcherRegistry matcherRegistry;
    @Mock
    OperationsCategorizer categorizer;

    ForecastService forecastService;

    private final PlannedOperation rent = new PlannedOperation("Rent", Amount.of(-900, "EUR"), Category.RENT,
            RecurringDateRange.recurringDay(LocalDate.parse("2025-01-01"), Period.ofMonths(1))).withId(1L);

    private final HistoricOperation payment = new HistoricOperation(10, "Rent March", Amount.of(-900, "EUR"),
            Category.UNCATEGORIZED, LocalDate.parse("2025-03-01"));

    private final Account account = new Account("Main", 2500, "EUR", LocalDate.parse("2025-03-10"), List.of(payment));

    @BeforeEach
    void setUp() {
        forecastService = new ForecastService(forecastRepository, linkRepository, linkService, matcherRegistry, categorizer);
    }

    @Test
    void actualizedForecastStartsAfterLinkedIteration() {
        when(forecastRepository.findPlannedOperations()).thenReturn(List.of(rent));
        when(forecastRepository.findBudgets()).thenReturn(List.of());
        when(linkRepository.findAll()).thenReturn(List.of(
                OperationLink.automatic(10, LinkType.PLANNED_OPERATION, 1, LocalDate.parse("2025-03-01"))));

        Forecast forecast = forecastService.actualizedForecast(account);

        assertThat(forecast.operations()).singleElement()
                .satisfies(operation -> assertThat(operation.dateRange().startDate()).isEqualTo(LocalDate.parse("2025-04-01")));
    }

    @Test
    void categorizeUsesStoredPlannedOperations() {
        HistoricOperation categorized = payment.withCategory(Category.RENT);
        when(forecastRepository.findPlannedOperations()).thenReturn(List.of(rent));
        when(categorizer.categorize(account.operations(), List.of(rent))).thenReturn(List.of(categorized));

        Account result = forecastService.categorize(account);

        assertThat(result.operations()).containsExactly(categorized);
        assertThat(result.balance()).isEqualTo(account.balance());
    }

    @Test
    void linkingRefreshesMatchersOfLinkedTargets() {
        MatcherKey key = new MatcherKey(LinkType.PLANNED_OPERATION, 1);
        OperationMatcher stale = new OperationMatcher(rent);
        OperationLink link = OperationLink.automatic(10, LinkType.PLANNED_OPERATION, 1, LocalDate.parse("2025-03-01"));
        OperationMatcher refreshed = new OperationMatcher(rent, List.of(link));
        when(matcherRegistry.snapshot()).thenReturn(Map.of(key, stale));
        when(linkService.createHeuristicLinks(account.operations(), Map.of(key, stale))).thenReturn(List.of(link));
        when(matcherRegistry.get(key)).thenReturn(Optional.of(stale));
        when(linkService.matcherFor(rent)).thenReturn(refreshed);

        List<OperationLink> created = forecastService.linkOperations(account);

        assertThat(created).containsExactly(link);
        verify(matcherRegistry).put(refreshed);
    }

    @Test
    void linkingWithoutNewLinksLeavesRegistryAlone() {
        when(matcherRegistry.snapshot()).thenReturn(Map.of());
        when(linkService.createHeuristicLinks(account.operations(), Map.of())).thenReturn(List.of());

        assertThat(forecastService.linkOperations(account)).isEmpty();
        verify(matcherRegistry, never()).put(any());
    }

    @Test
    void lateIterationsAreReportedPerTarget() {
        PlannedOperation electricity = new PlannedOperation("Electricity", Amount.of(-60, "EUR"), Category.ELECTRICITY,
                RecurringDateRange.recurringDay(LocalDate.parse("2025-03-08"), Period.ofMonths(1))).withId(2L);
        MatcherKey rentKey = MatcherKey.of(rent);
        MatcherKey electricityKey = MatcherKey.of(electricity);
        when(matcherRegistry.snapshot()).thenReturn(Map.of(
                rentKey, new OperationMatcher(rent),
                electricityKey, new OperationMatcher(electricity)
        ));

        Map<MatcherKey, List<DateSpan>> late = forecastService.lateIterations(account.withOperations(List.of(
                payment.withCategory(Category.RENT))));

        assertThat(late).containsOnlyKeys(electricityKey);
        assertThat(late.get(electricityKey)).containsExactly(DateSpan.singleDay(LocalDate.parse("2025-03-08")));
    }
}
