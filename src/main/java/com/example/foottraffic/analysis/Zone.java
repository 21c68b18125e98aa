package com.example.foottraffic.analysis;

import lombok.Value;

import java.util.List;

/**
 * 区域配置
 * <p>
 * 多边形顶点按顺序给出，假定为简单多边形（不自交），自交多边形在顶点附近的判断结果不保证一致。
 */
@Value
public class Zone {

    String id;
    String name;
    List<Point> points;
    int capacity;
    ZoneType type;

    public Zone(String id, String name, List<Point> points, int capacity, ZoneType type) {
        this.id = id;
        this.name = name;
        this.points = List.copyOf(points);
        this.capacity = capacity;
        this.type = type == null ? ZoneType.COUNTING : type;
    }

    /**
     * 默认区域：覆盖1920x1080画面的主体部分
     */
    public static Zone defaultZone() {
        return new Zone("default", "Main Area", List.of(
                new Point(100, 100),
                new Point(1820, 100),
                new Point(1820, 980),
                new Point(100, 980)
        ), 100, ZoneType.COUNTING);
    }

    /**
     * 射线法判断点是否在多边形内（水平射线，逐边判断）
     */
    public boolean contains(double x, double y) {
        int n = points.size();
        if (n < 3) return false;

        boolean inside = false;
        double p1x = points.get(0).getX();
        double p1y = points.get(0).getY();

        for (int i = 1; i <= n; i++) {
            double p2x = points.get(i % n).getX();
            double p2y = points.get(i % n).getY();

            if (y > Math.min(p1y, p2y) && y <= Math.max(p1y, p2y) && x <= Math.max(p1x, p2x)) {
                double xIntersect = p1y != p2y ? (y - p1y) * (p2x - p1x) / (p2y - p1y) + p1x : p1x;
                if (p1x == p2x || x <= xIntersect) {
                    inside = !inside;
                }
            }
            p1x = p2x;
            p1y = p2y;
        }

        return inside;
    }

    /**
     * 占用百分比，容量为0时返回0
     */
    public double occupancyPercent(int count) {
        if (capacity <= 0) return 0.0;
        return count * 100.0 / capacity;
    }
}
