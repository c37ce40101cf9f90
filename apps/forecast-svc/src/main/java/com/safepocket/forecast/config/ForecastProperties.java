package com.safepocket.forecast.config;

import com.safepocket.forecast.calendar.DateTolerance;
import com.safepocket.forecast.operation.AmountTolerance;
import com.safepocket.forecast.operation.MatchCriteria;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "forecast")
public record ForecastProperties(
        PlannedOperation plannedOperation,
        Budget budget,
        Linking linking
) {

    @ConstructorBinding
    public ForecastProperties {
        if (plannedOperation == null) {
            plannedOperation = new PlannedOperation(null, null);
        }
        if (budget == null) {
            budget = new Budget(null, null);
        }
        if (linking == null) {
            linking = new Linking(null, null, null, null, null);
        }
    }

    public record PlannedOperation(Integer toleranceDays, Double amountRatio) {
        public PlannedOperation {
            if (toleranceDays == null) {
                toleranceDays = MatchCriteria.PLANNED_OPERATION_TOLERANCE_DAYS;
            }
            if (amountRatio == null) {
                amountRatio = MatchCriteria.PLANNED_OPERATION_AMOUNT_RATIO;
            }
            if (toleranceDays < 0) {
                throw new IllegalArgumentException("toleranceDays must not be negative");
            }
            if (amountRatio < 0) {
                throw new IllegalArgumentException("amountRatio must not be negative");
            }
        }

        public MatchCriteria defaultCriteria() {
            return new MatchCriteria(Set.of(), DateTolerance.days(toleranceDays), AmountTolerance.ratio(amountRatio));
        }
    }

    /**
     * A missing amount ratio leaves budget amounts unbounded.
     */
    public record Budget(Integer toleranceDays, Double amountRatio) {
        public Budget {
            if (toleranceDays == null) {
                toleranceDays = 0;
            }
            if (toleranceDays < 0) {
                throw new IllegalArgumentException("toleranceDays must not be negative");
            }
            if (amountRatio != null && amountRatio < 0) {
                throw new IllegalArgumentException("amountRatio must not be negative");
            }
        }

        public MatchCriteria defaultCriteria() {
            AmountTolerance amountTolerance = amountRatio == null
                    ? AmountTolerance.unbounded()
                    : AmountTolerance.ratio(amountRatio);
            return new MatchCriteria(Set.of(), DateTolerance.days(toleranceDays), amountTolerance);
        }
    }

    public record Linking(
            Double amountWeight,
            Double dateWeight,
            Double categoryWeight,
            Double descriptionWeight,
            Integer dateDecayDays
    ) {
        public Linking {
            amountWeight = amountWeight == null ? 40.0 : amountWeight;
            dateWeight = dateWeight == null ? 30.0 : dateWeight;
            categoryWeight = categoryWeight == null ? 20.0 : categoryWeight;
            descriptionWeight = descriptionWeight == null ? 10.0 : descriptionWeight;
            dateDecayDays = dateDecayDays == null ? 30 : dateDecayDays;
            if (amountWeight < 0 || dateWeight < 0 || categoryWeight < 0 || descriptionWeight < 0) {
                throw new IllegalArgumentException("score weights must not be negative");
            }
            if (dateDecayDays <= 0) {
                throw new IllegalArgumentException("dateDecayDays must be positive");
            }
        }
    }
}
