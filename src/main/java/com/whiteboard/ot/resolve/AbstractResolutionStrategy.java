package com.whiteboard.ot.resolve;

import com.whiteboard.ot.exception.ConflictResolutionException;
import com.whiteboard.ot.model.ConflictInfo;
import com.whiteboard.ot.model.Operation;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 内置策略基类：先检查操作集非空，再交给子类归约
 */
public abstract class AbstractResolutionStrategy implements ConflictResolutionStrategy {

    /** Lamport 升序，相同时按 userId 升序 */
    protected static final Comparator<Operation> CAUSAL_ORDER = Comparator
        .comparingLong(Operation::getLamportTimestamp)
        .thenComparing(Operation::getUserId, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    @Override
    public final Optional<Operation> resolve(ConflictInfo conflict, Map<String, Integer> userPriorities) {
        List<Operation> operations = conflict.getOperations();
        if (operations == null || operations.isEmpty()) {
            throw ConflictResolutionException.noOperations(conflict.getId());
        }
        if (operations.size() == 1) {
            return Optional.of(operations.get(0));
        }
        return doResolve(conflict, operations, userPriorities != null ? userPriorities : Map.of());
    }

    /**
     * @param operations 至少两个操作
     */
    protected abstract Optional<Operation> doResolve(ConflictInfo conflict, List<Operation> operations,
                                                     Map<String, Integer> userPriorities);
}
