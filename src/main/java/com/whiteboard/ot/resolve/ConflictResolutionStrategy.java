package com.whiteboard.ot.resolve;

import com.whiteboard.ot.model.ConflictInfo;
import com.whiteboard.ot.model.Operation;

import java.util.Map;
import java.util.Optional;

/**
 * 冲突解决策略
 *
 * 内置策略之外可通过 {@link ConflictResolver#registerCustom} 注册自定义实现。
 */
public interface ConflictResolutionStrategy {

    /**
     * 策略名，作为注册表键
     */
    String name();

    /**
     * 把冲突中的操作归约为一个结果操作
     *
     * @param conflict       冲突，operations 为空时必须抛出异常
     * @param userPriorities userId -> 优先级，数值越大越优先
     * @return 结果操作；空表示需要人工处理
     */
    Optional<Operation> resolve(ConflictInfo conflict, Map<String, Integer> userPriorities);
}
