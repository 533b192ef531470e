package com.whiteboard.ot.model;

/**
 * @param timeDiffMs   两个操作时间戳之差的绝对值
 * @param simultaneous 是否视为同时发生
 */
public record TemporalProximity(long timeDiffMs, boolean simultaneous) {
}
