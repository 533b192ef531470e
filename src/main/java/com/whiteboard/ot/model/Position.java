package com.whiteboard.ot.model;

/**
 * 画布坐标
 */
public record Position(double x, double y) {

    public double distanceTo(Position other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    public Position offset(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }
}
