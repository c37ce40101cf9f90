package com.safepocket.forecast.link;

import com.safepocket.forecast.model.LinkType;
import com.safepocket.forecast.operation.OperationRange;

public record MatcherKey(LinkType type, long targetId) {

    public MatcherKey {
        if (type == null) {
            throw new IllegalArgumentException("type must be provided");
        }
    }

    public static MatcherKey of(OperationRange range) {
        if (range.id() == null) {
            throw new IllegalArgumentException("range '" + range.description() + "' has not been persisted");
        }
        return new MatcherKey(range.linkType(), range.id());
    }
}
