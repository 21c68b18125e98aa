package com.example.foottraffic.service;

import com.example.foottraffic.dto.AnalyticsSnapshot;

/**
 * 快照接收方（存储、看板等），由 {@link AnalyticsPublisher} 按固定间隔调用
 */
@FunctionalInterface
public interface AnalyticsSink {

    void accept(AnalyticsSnapshot snapshot);
}
