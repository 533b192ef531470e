package com.whiteboard.ot.model;

/**
 * 包围盒相交指标
 *
 * @param area       相交面积
 * @param percentage 相交面积 / 并集面积（IoU），0..1
 * @param distance   边缘间最短距离，重叠时为 0
 */
public record SpatialOverlap(double area, double percentage, double distance) {
}
