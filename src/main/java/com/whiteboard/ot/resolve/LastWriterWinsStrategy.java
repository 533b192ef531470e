package com.whiteboard.ot.resolve;

import com.whiteboard.ot.model.ConflictInfo;
import com.whiteboard.ot.model.Operation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lamport 时间戳最大者胜出，相同时 userId 较大者胜出
 */
public class LastWriterWinsStrategy extends AbstractResolutionStrategy {

    @Override
    public String name() {
        return ResolutionStrategy.LAST_WRITER_WINS.value();
    }

    @Override
    protected Optional<Operation> doResolve(ConflictInfo conflict, List<Operation> operations,
                                            Map<String, Integer> userPriorities) {
        return operations.stream().max(CAUSAL_ORDER);
    }
}
