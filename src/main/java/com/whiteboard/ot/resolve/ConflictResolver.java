package com.whiteboard.ot.resolve;

import com.whiteboard.ot.config.OtEngineProperties;
import com.whiteboard.ot.exception.ConflictResolutionException;
import com.whiteboard.ot.model.ConflictInfo;
import com.whiteboard.ot.model.ConflictSeverity;
import com.whiteboard.ot.model.ConflictType;
import com.whiteboard.ot.model.Operation;
import com.whiteboard.ot.model.OperationType;
import com.whiteboard.ot.model.ResolutionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 冲突解决器
 *
 * 内置策略按枚举分派，自定义策略按名称注册。
 * 未指定策略时根据冲突类型与严重度选择默认策略:
 * - HIGH 且并发操作数达到人工阈值: manual
 * - spatial / temporal: last-writer-wins
 * - semantic 且涉及 delete: 配置了用户优先级时 priority-user，否则 last-writer-wins
 * - 其他 semantic / concurrent_modification: merge
 */
@Slf4j
@Component
public class ConflictResolver {

    private final Map<ResolutionStrategy, ConflictResolutionStrategy> builtIns = new EnumMap<>(ResolutionStrategy.class);
    private final Map<String, ConflictResolutionStrategy> customStrategies = new ConcurrentHashMap<>();
    private final OtEngineProperties.DetectionConfig detection;

    public ConflictResolver(OtEngineProperties properties) {
        this.detection = properties.getDetection();
        builtIns.put(ResolutionStrategy.MERGE, new MergeStrategy());
        builtIns.put(ResolutionStrategy.LAST_WRITER_WINS, new LastWriterWinsStrategy());
        builtIns.put(ResolutionStrategy.PRIORITY_USER, new PriorityUserStrategy());
        builtIns.put(ResolutionStrategy.MANUAL, new ManualStrategy());
    }

    /**
     * 注册自定义策略；名称不能与内置策略重复
     */
    public void registerCustom(ConflictResolutionStrategy strategy) {
        String name = strategy.name();
        if (ResolutionStrategy.fromValue(name).isPresent()) {
            throw new IllegalArgumentException("Strategy name is reserved by a built-in strategy: " + name);
        }
        ConflictResolutionStrategy previous = customStrategies.put(name, strategy);
        log.info("Custom resolution strategy registered: name={}, replaced={}", name, previous != null);
    }

    public boolean unregisterCustom(String name) {
        return customStrategies.remove(name) != null;
    }

    public ResolutionStrategy selectStrategy(ConflictInfo conflict, Map<String, Integer> userPriorities) {
        if (conflict.getSeverity() == ConflictSeverity.HIGH
            && conflict.getConcurrentOperationCount() >= detection.getManualEscalationThreshold()) {
            return ResolutionStrategy.MANUAL;
        }
        if (conflict.getType() == ConflictType.SPATIAL || conflict.getType() == ConflictType.TEMPORAL) {
            return ResolutionStrategy.LAST_WRITER_WINS;
        }
        if (conflict.getType() == ConflictType.SEMANTIC && involvesDelete(conflict)) {
            return userPriorities != null && !userPriorities.isEmpty()
                ? ResolutionStrategy.PRIORITY_USER
                : ResolutionStrategy.LAST_WRITER_WINS;
        }
        return ResolutionStrategy.MERGE;
    }

    /**
     * 默认策略解决
     */
    public Resolution resolve(ConflictInfo conflict, Map<String, Integer> userPriorities) {
        return resolve(conflict, selectStrategy(conflict, userPriorities), userPriorities);
    }

    public Resolution resolve(ConflictInfo conflict, ResolutionStrategy strategy, Map<String, Integer> userPriorities) {
        return execute(conflict, strategy.value(), builtIns.get(strategy), userPriorities);
    }

    /**
     * 按名称解决，内置策略优先
     */
    public Resolution resolve(ConflictInfo conflict, String strategyName, Map<String, Integer> userPriorities) {
        Optional<ResolutionStrategy> builtIn = ResolutionStrategy.fromValue(strategyName);
        if (builtIn.isPresent()) {
            return resolve(conflict, builtIn.get(), userPriorities);
        }
        ConflictResolutionStrategy custom = customStrategies.get(strategyName);
        if (custom == null) {
            throw new ConflictResolutionException("Unknown resolution strategy: " + strategyName);
        }
        return execute(conflict, strategyName, custom, userPriorities);
    }

    private Resolution execute(ConflictInfo conflict, String strategyName, ConflictResolutionStrategy strategy,
                               Map<String, Integer> userPriorities) {
        long start = System.nanoTime();
        Optional<Operation> outcome = strategy.resolve(conflict, userPriorities);
        long elapsed = System.nanoTime() - start;

        if (outcome.isEmpty()) {
            log.info("Manual conflict resolution required: conflictId={}, type={}",
                conflict.getId(), conflict.getType().value());
            return new Resolution(strategyName, strategy.getClass().getSimpleName(), null,
                ResolutionStatus.PENDING_MANUAL, 0, elapsed);
        }

        Operation resolved = outcome.get();
        log.debug("Conflict resolved: conflictId={}, strategy={}, outcome={}",
            conflict.getId(), strategyName, resolved.getId());
        return new Resolution(strategyName, strategy.getClass().getSimpleName(), resolved,
            ResolutionStatus.RESOLVED, confidence(conflict, strategyName, resolved), elapsed);
    }

    /**
     * 基础 0.5；两方时间冲突 +0.3；复杂语义冲突 -0.2；带数据的合并 +0.2
     */
    static double confidence(ConflictInfo conflict, String strategyName, Operation resolved) {
        double confidence = 0.5;
        if (conflict.getType() == ConflictType.TEMPORAL && conflict.getOperations().size() == 2) {
            confidence += 0.3;
        }
        if (conflict.getType() == ConflictType.SEMANTIC && conflict.getSemanticConflict() != null
            && conflict.getSemanticConflict().incompatibleChanges().size() > 2) {
            confidence -= 0.2;
        }
        if (ResolutionStrategy.MERGE.value().equals(strategyName) && !resolved.dataOrEmpty().isEmpty()) {
            confidence += 0.2;
        }
        return Math.max(0, Math.min(1, confidence));
    }

    private static boolean involvesDelete(ConflictInfo conflict) {
        return conflict.getOperations().stream().anyMatch(op -> op.isOfType(OperationType.DELETE));
    }
}
