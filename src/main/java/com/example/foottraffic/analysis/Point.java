package com.example.foottraffic.analysis;

import lombok.Value;

/**
 * 图像坐标点
 */
@Value
public class Point {
    double x;
    double y;
}
