package com.example.foottraffic.tracking;

import lombok.Value;

/**
 * 图像像素坐标下的边界框 [left, top, right, bottom]
 */
@Value
public class BoundingBox {

    double left;
    double top;
    double right;
    double bottom;

    /**
     * 由中心点和尺寸构造
     */
    public static BoundingBox fromCenter(double cx, double cy, double width, double height) {
        return new BoundingBox(cx - width / 2, cy - height / 2, cx + width / 2, cy + height / 2);
    }

    public double getWidth() {
        return right - left;
    }

    public double getHeight() {
        return bottom - top;
    }

    public double getCenterX() {
        return (left + right) / 2;
    }

    public double getCenterY() {
        return (top + bottom) / 2;
    }

    public double getArea() {
        return getWidth() * getHeight();
    }

    public BoundingBox offset(double dx, double dy) {
        return new BoundingBox(left + dx, top + dy, right + dx, bottom + dy);
    }

    /**
     * 坐标有限且宽高为正
     */
    public boolean isValid() {
        return Double.isFinite(left) && Double.isFinite(top)
                && Double.isFinite(right) && Double.isFinite(bottom)
                && right > left && bottom > top;
    }

    /**
     * 计算与另一个边界框的IoU
     */
    public double iou(BoundingBox other) {
        if (other == null) return 0.0;

        double x1 = Math.max(left, other.left);
        double y1 = Math.max(top, other.top);
        double x2 = Math.min(right, other.right);
        double y2 = Math.min(bottom, other.bottom);

        if (x2 <= x1 || y2 <= y1) return 0.0;

        double intersection = (x2 - x1) * (y2 - y1);
        double union = getArea() + other.getArea() - intersection;

        return union > 0 ? intersection / union : 0.0;
    }
}
