package com.example.foottraffic.service;

import com.example.foottraffic.dto.AnalyticsSnapshot;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;

/**
 * 按固定间隔生成快照，推送给订阅者和各个 {@link AnalyticsSink}
 */
@Slf4j
@Service
public class AnalyticsPublisher {

    private final TrafficAnalyzer analyzer;
    private final List<AnalyticsSink> sinks;
    private final Sinks.Many<AnalyticsSnapshot> snapshotSink = Sinks.many().replay().latest();

    @Autowired
    public AnalyticsPublisher(TrafficAnalyzer analyzer, ObjectProvider<AnalyticsSink> sinks) {
        this(analyzer, sinks.orderedStream().toList());
    }

    public AnalyticsPublisher(TrafficAnalyzer analyzer, List<AnalyticsSink> sinks) {
        this.analyzer = analyzer;
        this.sinks = List.copyOf(sinks);
        log.info("📡 快照推送已启动，接收方{}个", this.sinks.size());
    }

    @Scheduled(fixedRateString = "${traffic.publish.interval-ms:1000}")
    public void publish() {
        AnalyticsSnapshot snapshot = analyzer.snapshot();
        snapshotSink.tryEmitNext(snapshot);

        for (AnalyticsSink sink : sinks) {
            try {
                sink.accept(snapshot);
            } catch (Exception e) {
                log.warn("快照推送失败 [{}]: {}", sink.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    /**
     * 快照流，新订阅者先收到最近一次快照
     */
    public Flux<AnalyticsSnapshot> stream() {
        return snapshotSink.asFlux();
    }

    @PreDestroy
    public void shutdown() {
        snapshotSink.tryEmitComplete();
    }
}
