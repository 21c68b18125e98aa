package com.example.foottraffic.dto;

import com.example.foottraffic.analysis.AnalysisMode;
import com.example.foottraffic.analysis.DensityLevel;
import com.example.foottraffic.analysis.ZoneType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 客流分析快照，生成后不可变
 */
@Value
@Builder
public class AnalyticsSnapshot {

    /**
     * 当前人数
     */
    int currentCount;

    /**
     * 累计进入人数
     */
    int totalEntries;

    /**
     * 累计离开人数
     */
    int totalExits;

    /**
     * 累计访客数（每次进入加一）
     */
    int uniqueVisitors;

    /**
     * 处理帧率
     */
    double fps;

    /**
     * 各区域占用，按区域ID索引
     */
    Map<String, ZoneView> zones;

    /**
     * 当前分析模式
     */
    AnalysisMode mode;

    /**
     * 是否处于人群模式
     */
    boolean crowdMode;

    /**
     * 人群估计置信度
     */
    double crowdConfidence;

    /**
     * 密度等级
     */
    DensityLevel densityLevel;

    /**
     * 已处理帧数
     */
    long framesProcessed;

    /**
     * 因上一帧未完成而丢弃的帧数
     */
    long framesDropped;

    /**
     * 处理出错的帧数
     */
    long framesFailed;

    /**
     * 时间戳
     */
    LocalDateTime timestamp;

    /**
     * 区域占用详情
     */
    @Value
    @Builder
    public static class ZoneView {

        String name;

        ZoneType type;

        /**
         * 当前人数
         */
        int count;

        /**
         * 最近30帧平均人数
         */
        double rollingAverage;

        int capacity;

        /**
         * 占用百分比，容量为0时为0
         */
        double occupancyPercent;
    }
}
