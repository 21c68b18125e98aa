package com.example.foottraffic.analysis;

import lombok.Value;

/**
 * 区域占用的不可变快照
 */
@Value
public class ZoneOccupancy {

    String zoneId;

    /**
     * 当前帧人数
     */
    int count;

    /**
     * 最近若干帧的平均人数
     */
    double rollingAverage;

    /**
     * 平均值所用的样本数
     */
    int samples;

    public static ZoneOccupancy empty(String zoneId) {
        return new ZoneOccupancy(zoneId, 0, 0.0, 0);
    }
}
