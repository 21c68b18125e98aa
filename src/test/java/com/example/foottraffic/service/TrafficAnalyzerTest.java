package com.example.foottraffic.service;

import com.example.foottraffic.analysis.AnalysisMode;
import com.example.foottraffic.analysis.CountingLine;
import com.example.foottraffic.analysis.FrameImage;
import com.example.foottraffic.analysis.Point;
import com.example.foottraffic.analysis.Zone;
import com.example.foottraffic.analysis.ZoneType;
import com.example.foottraffic.config.TrafficProperties;
import com.example.foottraffic.dto.AnalyticsSnapshot;
import com.example.foottraffic.tracking.Detection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrafficAnalyzerTest {

    private ControllableDetector detector;
    private TrafficAnalyzer analyzer;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        detector = new ControllableDetector();
        analyzer = new TrafficAnalyzer(new TrafficProperties(), detector);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        detector.release.countDown();
        executor.shutdownNow();
        analyzer.destroy();
    }

    private static VideoFrame frame(Detection... detections) {
        return VideoFrame.detectionsOnly(1920, 1080, List.of(detections));
    }

    private static Detection person(double top) {
        return Detection.of(50, top, 150, top + 100, 0.9);
    }

    private void walkDownAcrossLine() {
        assertThat(analyzer.processFrame(frame(person(480)))).isEqualTo(FrameOutcome.PROCESSED);
        assertThat(analyzer.processFrame(frame(person(500)))).isEqualTo(FrameOutcome.PROCESSED);
    }

    @Test
    void countsExitWhenTrackMovesDownAcrossLine() {
        walkDownAcrossLine();
        analyzer.processFrame(frame(person(520)));

        AnalyticsSnapshot snapshot = analyzer.snapshot();
        assertThat(snapshot.getTotalExits()).isEqualTo(1);
        assertThat(snapshot.getTotalEntries()).isZero();
        assertThat(snapshot.getUniqueVisitors()).isZero();
        assertThat(snapshot.getCurrentCount()).isEqualTo(1);
        assertThat(snapshot.getFramesProcessed()).isEqualTo(3);
        assertThat(snapshot.getMode()).isEqualTo(AnalysisMode.TRACKING);
        assertThat(snapshot.getFps()).isPositive();
    }

    @Test
    void countsEntryAndUniqueVisitorWhenTrackMovesUp() {
        analyzer.processFrame(frame(person(500)));
        analyzer.processFrame(frame(person(480)));

        AnalyticsSnapshot snapshot = analyzer.snapshot();
        assertThat(snapshot.getTotalEntries()).isEqualTo(1);
        assertThat(snapshot.getUniqueVisitors()).isEqualTo(1);
        assertThat(snapshot.getTotalExits()).isZero();
    }

    @Test
    void snapshotListsConfiguredZonesBeforeAnyFrame() {
        AnalyticsSnapshot snapshot = analyzer.snapshot();

        assertThat(snapshot.getZones()).containsOnlyKeys("default");
        AnalyticsSnapshot.ZoneView view = snapshot.getZones().get("default");
        assertThat(view.getCount()).isZero();
        assertThat(view.getCapacity()).isEqualTo(100);
        assertThat(snapshot.getFramesProcessed()).isZero();
    }

    @Test
    void zoneOccupancyFollowsTrackCenters() {
        analyzer.processFrame(frame(
                Detection.of(900, 300, 940, 400, 0.9),
                Detection.of(1000, 300, 1040, 400, 0.9),
                Detection.of(0, 0, 40, 40, 0.9)));

        AnalyticsSnapshot.ZoneView view = analyzer.snapshot().getZones().get("default");
        assertThat(view.getCount()).isEqualTo(2);
        assertThat(view.getOccupancyPercent()).isEqualTo(2.0);
        assertThat(analyzer.snapshot().getCurrentCount()).isEqualTo(3);
    }

    @Test
    void malformedDetectionsAreIgnored() {
        Detection inverted = Detection.of(150, 100, 50, 200, 0.9);
        Detection nan = Detection.of(10, 10, 20, Double.NaN, 0.9);

        List<Detection> detections = new ArrayList<>();
        detections.add(person(100));
        detections.add(inverted);
        detections.add(null);
        detections.add(nan);
        FrameOutcome outcome = analyzer.processFrame(VideoFrame.detectionsOnly(1920, 1080, detections));

        assertThat(outcome).isEqualTo(FrameOutcome.PROCESSED);
        assertThat(analyzer.snapshot().getCurrentCount()).isEqualTo(1);
    }

    @Test
    void framesArrivingWhileBusyAreDropped() throws Exception {
        detector.blockNextCall();
        Future<FrameOutcome> first = executor.submit(() -> analyzer.processFrame(frame(person(100))));
        assertThat(detector.entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(analyzer.processFrame(frame(person(100)))).isEqualTo(FrameOutcome.DROPPED);

        detector.release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(FrameOutcome.PROCESSED);

        AnalyticsSnapshot snapshot = analyzer.snapshot();
        assertThat(snapshot.getFramesDropped()).isEqualTo(1);
        assertThat(snapshot.getFramesProcessed()).isEqualTo(1);

        // 标志已释放，后续帧正常处理
        assertThat(analyzer.processFrame(frame(person(100)))).isEqualTo(FrameOutcome.PROCESSED);
    }

    @Test
    void failedFrameDoesNotStopProcessing() {
        walkDownAcrossLine();
        detector.failNextCall();

        assertThat(analyzer.processFrame(frame(person(520)))).isEqualTo(FrameOutcome.FAILED);
        assertThat(analyzer.processFrame(frame(person(540)))).isEqualTo(FrameOutcome.PROCESSED);

        AnalyticsSnapshot snapshot = analyzer.snapshot();
        assertThat(snapshot.getFramesFailed()).isEqualTo(1);
        assertThat(snapshot.getFramesProcessed()).isEqualTo(3);
        assertThat(snapshot.getTotalExits()).isEqualTo(1);
    }

    @Test
    void resetDuringProcessingTakesEffectAfterFrame() throws Exception {
        walkDownAcrossLine();

        detector.blockNextCall();
        Future<FrameOutcome> inFlight = executor.submit(() -> analyzer.processFrame(frame(person(520))));
        assertThat(detector.entered.await(5, TimeUnit.SECONDS)).isTrue();

        analyzer.reset();
        assertThat(analyzer.snapshot().getTotalExits()).isEqualTo(1);

        detector.release.countDown();
        assertThat(inFlight.get(5, TimeUnit.SECONDS)).isEqualTo(FrameOutcome.PROCESSED);

        AnalyticsSnapshot snapshot = analyzer.snapshot();
        assertThat(snapshot.getTotalExits()).isZero();
        assertThat(snapshot.getCurrentCount()).isZero();
        assertThat(snapshot.getZones().get("default").getRollingAverage()).isZero();
    }

    @Test
    void resetWhileIdleAppliesImmediately() {
        walkDownAcrossLine();

        analyzer.reset();

        AnalyticsSnapshot snapshot = analyzer.snapshot();
        assertThat(snapshot.getTotalExits()).isZero();
        assertThat(snapshot.getUniqueVisitors()).isZero();
        // 处理帧数不属于计数
        assertThat(snapshot.getFramesProcessed()).isEqualTo(2);
    }

    @Test
    void crowdModeWithoutImageUsesDetectorCount() {
        analyzer.processFrame(VideoFrame.detectionsOnly(1920, 1080, crowdOf(25)));

        AnalyticsSnapshot snapshot = analyzer.snapshot();
        assertThat(snapshot.isCrowdMode()).isTrue();
        assertThat(snapshot.getMode()).isEqualTo(AnalysisMode.CROWD);
        assertThat(snapshot.getCurrentCount()).isEqualTo(25);
        assertThat(snapshot.getCrowdConfidence()).isEqualTo(0.3);
        // 人数低于可跟踪上限，区域仍按轨迹统计
        assertThat(snapshot.getZones().get("default").getCount()).isEqualTo(25);
    }

    @Test
    void crowdModeWithImageUsesDensityMapForZones() {
        FrameImage dark = FrameImage.filled(320, 240, 0xFF202020);

        analyzer.processFrame(VideoFrame.of(dark, crowdOf(25)));

        AnalyticsSnapshot snapshot = analyzer.snapshot();
        assertThat(snapshot.isCrowdMode()).isTrue();
        assertThat(snapshot.getCurrentCount()).isEqualTo(25);
        // 全暗帧每格密度为1，乘以容量100和系数2
        assertThat(snapshot.getZones().get("default").getCount()).isEqualTo(200);
    }

    @Test
    void returnsToTrackingModeWhenCrowdThins() {
        analyzer.processFrame(VideoFrame.detectionsOnly(1920, 1080, crowdOf(25)));
        analyzer.processFrame(VideoFrame.detectionsOnly(1920, 1080, crowdOf(3)));

        AnalyticsSnapshot snapshot = analyzer.snapshot();
        assertThat(snapshot.isCrowdMode()).isFalse();
        assertThat(snapshot.getCrowdConfidence()).isEqualTo(0.95);
    }

    @Test
    void thresholdsApplyToFollowingFrames() {
        analyzer.updateThresholds(new Thresholds(0.5, 0.8, 30, 5, 0.7));

        analyzer.processFrame(VideoFrame.detectionsOnly(1920, 1080, crowdOf(6)));

        assertThat(analyzer.snapshot().isCrowdMode()).isTrue();
        assertThat(analyzer.getThresholds().getCrowdModeThreshold()).isEqualTo(5);
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> analyzer.setCountingLine(new CountingLine(5, 5, 5, 5)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> analyzer.setZones(List.of(new Zone("bad", "bad",
                List.of(new Point(0, 0), new Point(1, 1)), 10, ZoneType.COUNTING))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> analyzer.updateThresholds(new Thresholds(1.5, 0.8, 30, 20, 0.7)))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(analyzer.getCountingLine()).isEqualTo(CountingLine.defaultLine());
    }

    @Test
    void newCountingLineReplacesOldOne() {
        analyzer.setCountingLine(new CountingLine(0, 200, 1920, 200));

        analyzer.processFrame(frame(person(140)));
        analyzer.processFrame(frame(person(160)));

        assertThat(analyzer.snapshot().getTotalExits()).isEqualTo(1);
        assertThat(analyzer.getCountingLine().getStartY()).isEqualTo(200.0);
    }

    @Test
    void replacedZonesAppearInSnapshot() {
        analyzer.setZones(List.of(new Zone("door", "Door", List.of(
                new Point(0, 0), new Point(200, 0), new Point(200, 200), new Point(0, 200)), 0, ZoneType.ENTRY)));

        analyzer.processFrame(frame(Detection.of(50, 50, 100, 150, 0.9)));

        AnalyticsSnapshot snapshot = analyzer.snapshot();
        assertThat(snapshot.getZones()).containsOnlyKeys("door");
        assertThat(snapshot.getZones().get("door").getCount()).isEqualTo(1);
        assertThat(snapshot.getZones().get("door").getOccupancyPercent()).isZero();
        assertThat(snapshot.getZones().get("door").getType()).isEqualTo(ZoneType.ENTRY);
    }

    @Test
    void submitFrameProcessesOnWorker() {
        StepVerifier.create(analyzer.submitFrame(frame(person(100))))
                .expectNext(FrameOutcome.PROCESSED)
                .verifyComplete();

        assertThat(detector.lastThread).startsWith("traffic-worker");
        assertThat(analyzer.snapshot().getFramesProcessed()).isEqualTo(1);
    }

    @Test
    void submitFrameDropsWhileBusy() throws Exception {
        detector.blockNextCall();
        Future<FrameOutcome> first = executor.submit(() -> analyzer.processFrame(frame(person(100))));
        assertThat(detector.entered.await(5, TimeUnit.SECONDS)).isTrue();

        StepVerifier.create(analyzer.submitFrame(frame(person(100))))
                .expectNext(FrameOutcome.DROPPED)
                .verifyComplete();

        detector.release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(FrameOutcome.PROCESSED);
    }

    @Test
    void submissionCancelledBeforeStartReleasesPipeline() throws Exception {
        Scheduler testWorker = Schedulers.newSingle("test-worker");
        TrafficAnalyzer queued = new TrafficAnalyzer(new TrafficProperties(), detector, testWorker);
        CountDownLatch workerBusy = new CountDownLatch(1);
        testWorker.schedule(() -> {
            try {
                workerBusy.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        try {
            // 处理线程被占用，提交的帧仍在排队时取消订阅
            Disposable subscription = queued.submitFrame(frame(person(100))).subscribe();
            subscription.dispose();

            assertThat(queued.processFrame(frame(person(100)))).isEqualTo(FrameOutcome.PROCESSED);

            workerBusy.countDown();
            CountDownLatch drained = new CountDownLatch(1);
            testWorker.schedule(drained::countDown);
            assertThat(drained.await(5, TimeUnit.SECONDS)).isTrue();

            // 被取消的帧不会再进入处理流程
            assertThat(queued.snapshot().getFramesProcessed()).isEqualTo(1);
            assertThat(queued.processFrame(frame(person(100)))).isEqualTo(FrameOutcome.PROCESSED);
        } finally {
            workerBusy.countDown();
            queued.destroy();
        }
    }

    private static List<Detection> crowdOf(int n) {
        List<Detection> detections = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double left = 200 + i * 60;
            detections.add(Detection.of(left, 300, left + 40, 400, 0.9));
        }
        return detections;
    }

    /**
     * 使用随帧检测，可让下一次调用阻塞或抛出异常
     */
    private static class ControllableDetector implements PersonDetector {

        private final PersonDetector delegate = new AttachedDetectionsDetector();
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private volatile boolean block;
        private volatile boolean fail;
        private volatile String lastThread;

        void blockNextCall() {
            block = true;
        }

        void failNextCall() {
            fail = true;
        }

        @Override
        public List<Detection> detect(VideoFrame frame) {
            lastThread = Thread.currentThread().getName();
            if (fail) {
                fail = false;
                throw new IllegalStateException("detector unavailable");
            }
            if (block) {
                block = false;
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return delegate.detect(frame);
        }
    }
}
