package com.whiteboard.ot.clock;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * 不可变向量时钟：userId -> 计数器
 *
 * 缺失的条目按 0 处理。所有修改方法都返回新实例，
 * 因此可以在操作之间安全共享。
 */
public final class VectorClock {

    private static final VectorClock EMPTY = new VectorClock(Map.of());

    private final Map<String, Long> entries;

    private VectorClock(Map<String, Long> entries) {
        this.entries = entries;
    }

    public static VectorClock empty() {
        return EMPTY;
    }

    public static VectorClock of(String userId, long counter) {
        return of(Map.of(userId, counter));
    }

    public static VectorClock of(Map<String, Long> entries) {
        Objects.requireNonNull(entries, "entries");
        for (var entry : entries.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("Vector clock user id must not be blank");
            }
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new IllegalArgumentException("Vector clock counter must be >= 0: " + entry);
            }
        }
        return new VectorClock(Map.copyOf(entries));
    }

    public Map<String, Long> entries() {
        return entries;
    }

    public long get(String userId) {
        return entries.getOrDefault(userId, 0L);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * 返回 userId 计数加一后的新时钟
     */
    public VectorClock increment(String userId) {
        Map<String, Long> next = new HashMap<>(entries);
        next.merge(userId, 1L, Long::sum);
        return new VectorClock(Map.copyOf(next));
    }

    /**
     * 逐分量取最大值
     */
    public VectorClock merge(VectorClock other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        Map<String, Long> merged = new HashMap<>(entries);
        for (var entry : other.entries.entrySet()) {
            merged.merge(entry.getKey(), entry.getValue(), Math::max);
        }
        return new VectorClock(Map.copyOf(merged));
    }

    public CausalOrder compare(VectorClock other) {
        boolean thisGreater = false;
        boolean otherGreater = false;

        for (String userId : allUsers(other)) {
            long thisVal = get(userId);
            long otherVal = other.get(userId);

            if (thisVal > otherVal) thisGreater = true;
            if (otherVal > thisVal) otherGreater = true;

            if (thisGreater && otherGreater) {
                return CausalOrder.CONCURRENT;
            }
        }

        if (thisGreater) return CausalOrder.AFTER;
        if (otherGreater) return CausalOrder.BEFORE;
        return CausalOrder.CONCURRENT;
    }

    /**
     * 计数不同的条目数量
     */
    public int divergence(VectorClock other) {
        int diverging = 0;
        for (String userId : allUsers(other)) {
            if (get(userId) != other.get(userId)) {
                diverging++;
            }
        }
        return diverging;
    }

    /**
     * 逐分量 >= other
     */
    public boolean covers(VectorClock other) {
        for (var entry : other.entries.entrySet()) {
            if (get(entry.getKey()) < entry.getValue()) {
                return false;
            }
        }
        return true;
    }

    private Set<String> allUsers(VectorClock other) {
        Set<String> users = new HashSet<>(entries.keySet());
        users.addAll(other.entries.keySet());
        return users;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VectorClock that)) return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return new TreeMap<>(entries).toString();
    }
}
