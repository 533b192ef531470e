package com.whiteboard.ot.clock;

/**
 * 两个向量时钟之间的因果关系
 */
public enum CausalOrder {
    BEFORE,      // 发生在之前
    AFTER,       // 发生在之后
    CONCURRENT   // 并发（互不支配，或两个不同操作的时钟完全相同）
}
