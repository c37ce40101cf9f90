package com.safepocket.forecast.model;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Association between a historic operation and one iteration of a planned operation or budget.
 * Manual links are asserted by the user and survive link recalculation.
 */
public record OperationLink(
        long operationId,
        LinkType targetType,
        long targetId,
        LocalDate iterationDate,
        boolean manual,
        Optional<String> notes
) {
    public OperationLink {
        if (targetType == null) {
            throw new IllegalArgumentException("targetType must be provided");
        }
        if (iterationDate == null) {
            throw new IllegalArgumentException("iterationDate must be provided");
        }
        notes = notes == null ? Optional.empty() : notes;
    }

    public static OperationLink automatic(long operationId, LinkType targetType, long targetId, LocalDate iterationDate) {
        return new OperationLink(operationId, targetType, targetId, iterationDate, false, Optional.empty());
    }

    public static OperationLink manual(long operationId, LinkType targetType, long targetId, LocalDate iterationDate, String notes) {
        return new OperationLink(operationId, targetType, targetId, iterationDate, true, Optional.ofNullable(notes));
    }

    public boolean targets(LinkType type, long id) {
        return targetType == type && targetId == id;
    }

    public OperationLink withTargetId(long newTargetId) {
        return new OperationLink(operationId, targetType, newTargetId, iterationDate, manual, notes);
    }
}
