package com.safepocket.forecast.repository;

import com.safepocket.forecast.model.LinkType;
import com.safepocket.forecast.model.OperationLink;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryOperationLinkRepository implements OperationLinkRepository {

    private final Map<Long, OperationLink> storage = new ConcurrentHashMap<>();

    @Override
    public List<OperationLink> findAll() {
        return storage.values().stream()
                .sorted(Comparator.comparingLong(OperationLink::operationId))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Optional<OperationLink> findByOperationId(long operationId) {
        return Optional.ofNullable(storage.get(operationId));
    }

    @Override
    public List<OperationLink> findByTarget(LinkType type, long targetId) {
        return storage.values().stream()
                .filter(link -> link.targets(type, targetId))
                .sorted(Comparator.comparingLong(OperationLink::operationId))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public OperationLink save(OperationLink link) {
        storage.put(link.operationId(), link);
        return link;
    }

    @Override
    public void deleteByOperationId(long operationId) {
        storage.remove(operationId);
    }

    @Override
    public int deleteByTarget(LinkType type, long targetId) {
        return removeIf(link -> link.targets(type, targetId));
    }

    @Override
    public int deleteAutomaticByTarget(LinkType type, long targetId) {
        return removeIf(link -> link.targets(type, targetId) && !link.manual());
    }

    private int removeIf(Predicate<OperationLink> predicate) {
        List<Long> removed = storage.values().stream()
                .filter(predicate)
                .map(OperationLink::operationId)
                .toList();
        removed.forEach(storage::remove);
        return removed.size();
    }
}
