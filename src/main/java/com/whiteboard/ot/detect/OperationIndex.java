package com.whiteboard.ot.detect;

import com.whiteboard.ot.model.Bounds;
import com.whiteboard.ot.model.Operation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 冲突候选索引
 *
 * 1. elementId -> 操作（同元素冲突）
 * 2. 均匀网格 cell -> 操作（跨元素空间冲突）
 * 3. 覆盖超过 MAX_CELLS_PER_OPERATION 个格子的大区域单独存放，每次查询都参与
 *
 * 同元素桶全部返回，并发的旧操作不能漏检；
 * 网格桶只取最近 maxCandidatesPerBucket 个，队列再长单次空间查询代价也有上限。
 * 非线程安全，由所属上下文的锁保护。
 */
public class OperationIndex {

    static final int MAX_CELLS_PER_OPERATION = 64;

    private final double cellSize;
    private final int maxCandidatesPerBucket;

    private final Map<String, Operation> byId = new LinkedHashMap<>();
    private final Map<String, List<Operation>> byElement = new HashMap<>();
    private final Map<Long, List<Operation>> byCell = new HashMap<>();
    private final List<Operation> oversized = new ArrayList<>();

    public OperationIndex(double cellSize, int maxCandidatesPerBucket) {
        if (cellSize <= 0) {
            throw new IllegalArgumentException("cellSize must be > 0");
        }
        if (maxCandidatesPerBucket <= 0) {
            throw new IllegalArgumentException("maxCandidatesPerBucket must be > 0");
        }
        this.cellSize = cellSize;
        this.maxCandidatesPerBucket = maxCandidatesPerBucket;
    }

    public void add(Operation op) {
        Operation previous = byId.put(op.getId(), op);
        if (previous != null) {
            removeFromBuckets(previous.getId(), previous);
        }
        byElement.computeIfAbsent(op.getElementId(), k -> new ArrayList<>()).add(op);

        Bounds region = op.region();
        if (region == null) {
            return;
        }
        List<Long> cells = cellsOf(region);
        if (cells.isEmpty()) {
            oversized.add(op);
        } else {
            for (Long cell : cells) {
                byCell.computeIfAbsent(cell, k -> new ArrayList<>()).add(op);
            }
        }
    }

    public void addAll(Collection<Operation> ops) {
        ops.forEach(this::add);
    }

    public boolean remove(String operationId) {
        Operation op = byId.remove(operationId);
        if (op == null) {
            return false;
        }
        removeFromBuckets(operationId, op);
        return true;
    }

    public void clear() {
        byId.clear();
        byElement.clear();
        byCell.clear();
        oversized.clear();
    }

    public int size() {
        return byId.size();
    }

    public Operation get(String operationId) {
        return byId.get(operationId);
    }

    /**
     * 与 op 可能相关的候选：同元素的全部操作 + 邻近格子（区域外扩 proximity）中的最近操作
     */
    public Collection<Operation> candidates(Operation op, double proximity) {
        Map<String, Operation> result = new LinkedHashMap<>();
        List<Operation> sameElement = byElement.get(op.getElementId());
        if (sameElement != null) {
            sameElement.forEach(candidate -> result.putIfAbsent(candidate.getId(), candidate));
        }

        Bounds region = op.region();
        if (region != null) {
            List<Long> cells = cellsOf(region.expand(proximity));
            if (cells.isEmpty()) {
                // 查询区域过大，退化为扫描所有带几何信息的操作
                for (List<Operation> bucket : byCell.values()) {
                    addTail(result, bucket);
                }
            } else {
                for (Long cell : cells) {
                    addTail(result, byCell.get(cell));
                }
            }
            addTail(result, oversized);
        }
        return result.values();
    }

    private void addTail(Map<String, Operation> result, List<Operation> bucket) {
        if (bucket == null || bucket.isEmpty()) {
            return;
        }
        int from = Math.max(0, bucket.size() - maxCandidatesPerBucket);
        for (int i = from; i < bucket.size(); i++) {
            Operation candidate = bucket.get(i);
            result.putIfAbsent(candidate.getId(), candidate);
        }
    }

    private void removeFromBuckets(String operationId, Operation op) {
        List<Operation> elementBucket = byElement.get(op.getElementId());
        if (elementBucket != null) {
            elementBucket.removeIf(o -> o.getId().equals(operationId));
            if (elementBucket.isEmpty()) {
                byElement.remove(op.getElementId());
            }
        }
        Bounds region = op.region();
        if (region == null) {
            return;
        }
        List<Long> cells = cellsOf(region);
        if (cells.isEmpty()) {
            oversized.removeIf(o -> o.getId().equals(operationId));
            return;
        }
        for (Long cell : cells) {
            List<Operation> bucket = byCell.get(cell);
            if (bucket != null) {
                bucket.removeIf(o -> o.getId().equals(operationId));
                if (bucket.isEmpty()) {
                    byCell.remove(cell);
                }
            }
        }
    }

    /**
     * 区域覆盖的格子；超过上限时返回空列表
     */
    private List<Long> cellsOf(Bounds region) {
        long minX = cellCoordinate(region.x());
        long maxX = cellCoordinate(region.right());
        long minY = cellCoordinate(region.y());
        long maxY = cellCoordinate(region.bottom());
        long count = (maxX - minX + 1) * (maxY - minY + 1);
        if (count > MAX_CELLS_PER_OPERATION || count <= 0) {
            return List.of();
        }
        List<Long> cells = new ArrayList<>((int) count);
        for (long cx = minX; cx <= maxX; cx++) {
            for (long cy = minY; cy <= maxY; cy++) {
                cells.add((cx << 32) ^ (cy & 0xFFFFFFFFL));
            }
        }
        return cells;
    }

    private long cellCoordinate(double value) {
        return (long) Math.floor(value / cellSize);
    }
}
