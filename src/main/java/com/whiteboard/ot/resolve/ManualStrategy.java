package com.whiteboard.ot.resolve;

import com.whiteboard.ot.model.ConflictInfo;
import com.whiteboard.ot.model.Operation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 交由人工处理：不产生结果，冲突保持打开
 */
public class ManualStrategy extends AbstractResolutionStrategy {

    @Override
    public String name() {
        return ResolutionStrategy.MANUAL.value();
    }

    @Override
    protected Optional<Operation> doResolve(ConflictInfo conflict, List<Operation> operations,
                                            Map<String, Integer> userPriorities) {
        return Optional.empty();
    }
}
