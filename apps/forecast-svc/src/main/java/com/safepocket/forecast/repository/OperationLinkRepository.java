package com.safepocket.forecast.repository;

import com.safepocket.forecast.model.LinkType;
import com.safepocket.forecast.model.OperationLink;
import java.util.List;
import java.util.Optional;

/**
 * Links keyed by operation: saving a link replaces any previous link of the same operation.
 */
public interface OperationLinkRepository {

    List<OperationLink> findAll();

    Optional<OperationLink> findByOperationId(long operationId);

    List<OperationLink> findByTarget(LinkType type, long targetId);

    OperationLink save(OperationLink link);

    void deleteByOperationId(long operationId);

    int deleteByTarget(LinkType type, long targetId);

    int deleteAutomaticByTarget(LinkType type, long targetId);
}
