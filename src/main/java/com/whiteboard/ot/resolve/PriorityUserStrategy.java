package com.whiteboard.ot.resolve;

import com.whiteboard.ot.model.ConflictInfo;
import com.whiteboard.ot.model.Operation;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 优先级最高的用户胜出（未配置的用户优先级为 0），相同时退化为 last-writer-wins
 */
public class PriorityUserStrategy extends AbstractResolutionStrategy {

    @Override
    public String name() {
        return ResolutionStrategy.PRIORITY_USER.value();
    }

    @Override
    protected Optional<Operation> doResolve(ConflictInfo conflict, List<Operation> operations,
                                            Map<String, Integer> userPriorities) {
        Comparator<Operation> byPriority = Comparator.comparingInt(
            op -> userPriorities.getOrDefault(op.getUserId(), 0));
        return operations.stream().max(byPriority.thenComparing(CAUSAL_ORDER));
    }
}
