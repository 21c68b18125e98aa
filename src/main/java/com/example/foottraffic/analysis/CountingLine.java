package com.example.foottraffic.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * 计数线，图像坐标下的两个端点
 */
@Value
public class CountingLine {

    double startX;
    double startY;
    double endX;
    double endY;

    /**
     * 默认计数线：1920宽画面中间的水平线
     */
    public static CountingLine defaultLine() {
        return new CountingLine(0, 540, 1920, 540);
    }

    /**
     * 点相对于线方向向量的叉积，正负号表示在线的哪一侧，0表示共线
     */
    public double side(double x, double y) {
        return (x - startX) * (endY - startY) - (y - startY) * (endX - startX);
    }

    @JsonIgnore
    public boolean isDegenerate() {
        return startX == endX && startY == endY;
    }
}
