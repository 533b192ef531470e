package com.whiteboard.ot.model;

/**
 * 元素包围盒
 * 宽高为 0 时退化为一个点（仅有 position 的操作）
 */
public record Bounds(double x, double y, double width, double height) {

    public static Bounds point(Position position) {
        return new Bounds(position.x(), position.y(), 0, 0);
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double area() {
        return width * height;
    }

    /**
     * 相交区域面积，不相交时为 0
     */
    public double intersectionArea(Bounds other) {
        double left = Math.max(x, other.x);
        double rightEdge = Math.min(right(), other.right());
        double top = Math.max(y, other.y);
        double bottomEdge = Math.min(bottom(), other.bottom());
        if (left < rightEdge && top < bottomEdge) {
            return (rightEdge - left) * (bottomEdge - top);
        }
        return 0;
    }

    /**
     * 两个矩形边缘之间的最短距离，重叠或接触时为 0
     */
    public double gapDistance(Bounds other) {
        double dx = Math.max(0, Math.max(x, other.x) - Math.min(right(), other.right()));
        double dy = Math.max(0, Math.max(y, other.y) - Math.min(bottom(), other.bottom()));
        return Math.hypot(dx, dy);
    }

    public Bounds expand(double margin) {
        return new Bounds(x - margin, y - margin, width + 2 * margin, height + 2 * margin);
    }
}
