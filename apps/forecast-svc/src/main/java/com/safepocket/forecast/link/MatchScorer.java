package com.safepocket.forecast.link;

import com.safepocket.forecast.config.ForecastProperties;
import com.safepocket.forecast.model.HistoricOperation;
import com.safepocket.forecast.operation.AmountTolerance;
import com.safepocket.forecast.operation.MatchCriteria;
import com.safepocket.forecast.operation.OperationRange;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Grades how well an operation fits one iteration of a range. Used to pick a target when several match.
 */
@Component
public class MatchScorer {

    private final ForecastProperties.Linking weights;

    public MatchScorer(ForecastProperties properties) {
        this.weights = properties.linking();
    }

    public double score(HistoricOperation operation, OperationRange range, LocalDate iterationDate) {
        MatchCriteria criteria = range.criteria();
        return amountScore(operation, range, criteria.amountTolerance())
                + dateScore(operation, iterationDate, criteria.dateTolerance().daysBefore(), criteria.dateTolerance().daysAfter())
                + (operation.category() == range.category() ? weights.categoryWeight() : 0.0)
                + descriptionScore(operation, criteria);
    }

    private double amountScore(HistoricOperation operation, OperationRange range, AmountTolerance tolerance) {
        double expected = Math.abs(range.amount().value());
        if (expected == 0.0) {
            return 0.0;
        }
        if (!(tolerance instanceof AmountTolerance.Ratio ratio)) {
            return weights.amountWeight();
        }
        double difference = Math.abs(Math.abs(operation.amount().value()) - expected) / expected;
        if (difference <= ratio.ratio()) {
            return weights.amountWeight();
        }
        return Math.max(0.0, weights.amountWeight() * (1 - (difference - ratio.ratio())));
    }

    private double dateScore(HistoricOperation operation, LocalDate iterationDate, int daysBefore, int daysAfter) {
        long offset = ChronoUnit.DAYS.between(iterationDate, operation.date());
        long tolerance = offset < 0 ? daysBefore : daysAfter;
        long distance = Math.abs(offset);
        if (distance <= tolerance) {
            return weights.dateWeight();
        }
        return Math.max(0.0, weights.dateWeight() * (1 - (double) (distance - tolerance) / weights.dateDecayDays()));
    }

    /**
     * Only awarded when hints are configured and all of them appear in the description.
     */
    private double descriptionScore(HistoricOperation operation, MatchCriteria criteria) {
        if (criteria.descriptionHints().isEmpty()) {
            return 0.0;
        }
        String description = operation.description().toLowerCase(Locale.ROOT);
        return criteria.descriptionHints().stream().allMatch(description::contains) ? weights.descriptionWeight() : 0.0;
    }
}
