package com.safepocket.forecast.operation;

import com.safepocket.forecast.calendar.DateTolerance;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public record MatchCriteria(
        Set<String> descriptionHints,
        DateTolerance dateTolerance,
        AmountTolerance amountTolerance
) {
    public static final int PLANNED_OPERATION_TOLERANCE_DAYS = 5;
    public static final double PLANNED_OPERATION_AMOUNT_RATIO = 0.05;

    public MatchCriteria {
        descriptionHints = descriptionHints == null ? Set.of() : descriptionHints.stream()
                .filter(hint -> hint != null && !hint.isBlank())
                .map(hint -> hint.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        if (dateTolerance == null) {
            dateTolerance = DateTolerance.NONE;
        }
        if (amountTolerance == null) {
            amountTolerance = AmountTolerance.unbounded();
        }
    }

    public static MatchCriteria plannedOperationDefaults() {
        return new MatchCriteria(
                Set.of(),
                DateTolerance.days(PLANNED_OPERATION_TOLERANCE_DAYS),
                AmountTolerance.ratio(PLANNED_OPERATION_AMOUNT_RATIO)
        );
    }

    public static MatchCriteria budgetDefaults() {
        return new MatchCriteria(Set.of(), DateTolerance.NONE, AmountTolerance.unbounded());
    }

    public MatchCriteria withDescriptionHints(Set<String> hints) {
        return new MatchCriteria(hints, dateTolerance, amountTolerance);
    }

    public MatchCriteria withDateTolerance(DateTolerance tolerance) {
        return new MatchCriteria(descriptionHints, tolerance, amountTolerance);
    }

    public MatchCriteria withAmountTolerance(AmountTolerance tolerance) {
        return new MatchCriteria(descriptionHints, dateTolerance, tolerance);
    }
}
