package com.example.foottraffic.service;

import com.example.foottraffic.config.TrafficProperties;
import com.example.foottraffic.dto.AnalyticsSnapshot;
import com.example.foottraffic.tracking.Detection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class AnalyticsPublisherTest {

    private TrafficAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new TrafficAnalyzer(new TrafficProperties(), new AttachedDetectionsDetector());
    }

    @AfterEach
    void tearDown() {
        analyzer.destroy();
    }

    @Test
    void failingSinkDoesNotBlockOthers() {
        List<AnalyticsSnapshot> received = new CopyOnWriteArrayList<>();
        AnalyticsSink failing = snapshot -> {
            throw new IllegalStateException("sink offline");
        };
        AnalyticsSink collecting = received::add;
        AnalyticsPublisher publisher = new AnalyticsPublisher(analyzer, List.of(failing, collecting));

        analyzer.processFrame(VideoFrame.detectionsOnly(1920, 1080,
                List.of(Detection.of(900, 300, 940, 400, 0.9))));
        publisher.publish();
        publisher.publish();

        assertThat(received).hasSize(2);
        assertThat(received.get(0).getCurrentCount()).isEqualTo(1);
    }

    @Test
    void lateSubscriberReceivesLatestSnapshot() {
        AnalyticsPublisher publisher = new AnalyticsPublisher(analyzer, List.of());

        publisher.publish();
        analyzer.processFrame(VideoFrame.detectionsOnly(1920, 1080,
                List.of(Detection.of(900, 300, 940, 400, 0.9), Detection.of(1000, 300, 1040, 400, 0.9))));
        publisher.publish();

        StepVerifier.create(publisher.stream().take(1))
                .assertNext(snapshot -> assertThat(snapshot.getCurrentCount()).isEqualTo(2))
                .verifyComplete();
    }

    @Test
    void shutdownCompletesStream() {
        AnalyticsPublisher publisher = new AnalyticsPublisher(analyzer, List.of());
        publisher.publish();
        publisher.shutdown();

        StepVerifier.create(publisher.stream())
                .expectNextCount(1)
                .verifyComplete();
    }
}
