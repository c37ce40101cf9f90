package com.safepocket.forecast.link;

import com.safepocket.forecast.operation.OperationMatcher;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Matchers of the persisted planned operations and budgets, kept in step with them by their owner.
 */
@Component
public class MatcherRegistry {

    private final Map<MatcherKey, OperationMatcher> matchers = new ConcurrentHashMap<>();

    public void put(OperationMatcher matcher) {
        matchers.put(MatcherKey.of(matcher.operationRange()), matcher);
    }

    public Optional<OperationMatcher> get(MatcherKey key) {
        return Optional.ofNullable(matchers.get(key));
    }

    public void remove(MatcherKey key) {
        matchers.remove(key);
    }

    public Map<MatcherKey, OperationMatcher> snapshot() {
        return new LinkedHashMap<>(matchers);
    }

    public void clear() {
        matchers.clear();
    }
}
