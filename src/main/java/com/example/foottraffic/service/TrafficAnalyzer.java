package com.example.foottraffic.service;

import com.example.foottraffic.analysis.AnalysisMode;
import com.example.foottraffic.analysis.CountingLine;
import com.example.foottraffic.analysis.CrossingDirection;
import com.example.foottraffic.analysis.CrowdAnalysis;
import com.example.foottraffic.analysis.CrowdDensityEstimator;
import com.example.foottraffic.analysis.DensityLevel;
import com.example.foottraffic.analysis.LineCounter;
import com.example.foottraffic.analysis.Zone;
import com.example.foottraffic.analysis.ZoneAggregator;
import com.example.foottraffic.analysis.ZoneOccupancy;
import com.example.foottraffic.config.TrafficProperties;
import com.example.foottraffic.dto.AnalyticsSnapshot;
import com.example.foottraffic.tracking.ByteTracker;
import com.example.foottraffic.tracking.Detection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 客流分析主流程
 * <p>
 * 每帧：检测 → 判断模式 → 跟踪+越线+区域统计（跟踪模式）或密度估计（人群模式）→ 更新计数。
 * 同一时刻只处理一帧，处理中到达的新帧直接丢弃，不排队。
 * 跟踪、越线、区域状态只由处理线程写入；计数器和区域占用可被其他线程并发读取，
 * 读到的是最终一致的快照。配置变更与重置都暂存起来，只在两帧之间生效。
 */
@Slf4j
@Service
public class TrafficAnalyzer implements DisposableBean {

    private final PersonDetector detector;
    private final ByteTracker tracker;
    private final LineCounter lineCounter;
    private final ZoneAggregator zoneAggregator = new ZoneAggregator();
    private final CrowdDensityEstimator crowdEstimator;
    private final int trackableLimit;

    private final Scheduler worker;
    private final AtomicBoolean processing = new AtomicBoolean(false);

    // 待生效的变更
    private final AtomicBoolean pendingReset = new AtomicBoolean(false);
    private final AtomicReference<CountingLine> pendingLine = new AtomicReference<>();
    private final AtomicReference<List<Zone>> pendingZones = new AtomicReference<>();
    private final AtomicReference<Thresholds> pendingThresholds = new AtomicReference<>();

    private volatile List<Zone> zones;
    private volatile Thresholds thresholds;

    // 计数
    private final AtomicInteger currentCount = new AtomicInteger(0);
    private final AtomicInteger totalEntries = new AtomicInteger(0);
    private final AtomicInteger totalExits = new AtomicInteger(0);
    private final AtomicInteger uniqueVisitors = new AtomicInteger(0);
    private final AtomicLong framesProcessed = new AtomicLong(0);
    private final AtomicLong framesDropped = new AtomicLong(0);
    private final AtomicLong framesFailed = new AtomicLong(0);

    private volatile double fps;
    private volatile CrowdAnalysis lastCrowdAnalysis;

    @Autowired
    public TrafficAnalyzer(TrafficProperties properties, PersonDetector detector) {
        this(properties, detector, Schedulers.newSingle("traffic-worker"));
    }

    TrafficAnalyzer(TrafficProperties properties, PersonDetector detector, Scheduler worker) {
        this.detector = detector;
        this.worker = worker;
        this.thresholds = Thresholds.from(properties);
        this.tracker = new ByteTracker(thresholds.getTrackThresh(), thresholds.getMatchThresh(),
                thresholds.getTrackBuffer());
        this.crowdEstimator = new CrowdDensityEstimator(thresholds.getCrowdModeThreshold(),
                thresholds.getHighDensityThreshold());
        this.lineCounter = new LineCounter(properties.getLine().toCountingLine());
        this.zones = List.copyOf(properties.toZones());
        this.trackableLimit = properties.getCrowd().getTrackableLimit();

        log.info("🚀 客流分析初始化完成 - 区域{}个, 跟踪阈值 {}/{}/{}, 人群阈值 {}/{}",
                zones.size(), thresholds.getTrackThresh(), thresholds.getMatchThresh(),
                thresholds.getTrackBuffer(), thresholds.getCrowdModeThreshold(),
                thresholds.getHighDensityThreshold());
    }

    /**
     * 在调用线程上同步处理一帧
     */
    public FrameOutcome processFrame(VideoFrame frame) {
        if (!processing.compareAndSet(false, true)) {
            return drop();
        }
        return runFrame(frame);
    }

    /**
     * 提交到处理线程异步处理；忙时立即返回 DROPPED
     */
    public Mono<FrameOutcome> submitFrame(VideoFrame frame) {
        return Mono.defer(() -> {
            if (!processing.compareAndSet(false, true)) {
                return Mono.just(drop());
            }
            AtomicBoolean started = new AtomicBoolean(false);
            return Mono.fromCallable(() -> {
                        // 与取消回调竞争处理标志的释放权，取消一方先到则不再处理
                        if (!started.compareAndSet(false, true)) {
                            return FrameOutcome.DROPPED;
                        }
                        return runFrame(frame);
                    })
                    .subscribeOn(worker)
                    .doOnCancel(() -> {
                        // 任务尚未开始就被取消，需要释放处理标志
                        if (started.compareAndSet(false, true)) {
                            releaseAndApplyPending();
                        }
                    });
        });
    }

    private FrameOutcome drop() {
        long dropped = framesDropped.incrementAndGet();
        log.debug("⏭️ 上一帧仍在处理，丢弃当前帧 (累计丢弃{})", dropped);
        return FrameOutcome.DROPPED;
    }

    /**
     * 调用前必须已持有处理标志
     */
    private FrameOutcome runFrame(VideoFrame frame) {
        try {
            applyPendingChanges();

            long start = System.nanoTime();
            FrameResult result = analyze(frame);
            long elapsed = System.nanoTime() - start;

            commit(result, elapsed);
            long processed = framesProcessed.incrementAndGet();

            if (processed % 100 == 0) {
                log.debug("📊 人数: {}, 进入: {}, 离开: {}, FPS: {}, 模式: {}",
                        currentCount.get(), totalEntries.get(), totalExits.get(),
                        String.format("%.1f", fps), result.crowd.getMode());
            }
            return FrameOutcome.PROCESSED;
        } catch (Exception e) {
            framesFailed.incrementAndGet();
            log.error("处理帧失败，跳过该帧: {}", e.getMessage(), e);
            return FrameOutcome.FAILED;
        } finally {
            releaseAndApplyPending();
        }
    }

    private FrameResult analyze(VideoFrame frame) {
        List<Detection> detections = sanitize(detector.detect(frame));
        CrowdAnalysis crowd = crowdEstimator.analyze(frame.getImage(), detections.size());
        List<Zone> activeZones = zones;

        FrameResult result = new FrameResult(crowd);

        if (crowd.getMode() == AnalysisMode.TRACKING) {
            List<Detection> tracked = tracker.update(detections);
            countCrossings(tracked, result);
            zoneAggregator.updateFromTracks(activeZones, tracked);
            result.count = tracked.size();
            return result;
        }

        List<Detection> tracked = null;
        if (detections.size() < trackableLimit) {
            tracked = tracker.update(detections);
            countCrossings(tracked, result);
        }

        if (frame.getImage() != null) {
            zoneAggregator.updateFromDensityMap(activeZones, crowd.getDensityMap(),
                    frame.getImage().getWidth(), frame.getImage().getHeight());
        } else if (tracked != null) {
            zoneAggregator.updateFromTracks(activeZones, tracked);
        }
        result.count = crowd.getEstimatedCount();
        return result;
    }

    private void countCrossings(List<Detection> tracked, FrameResult result) {
        Set<Integer> activeIds = new HashSet<>();
        for (Detection detection : tracked) {
            activeIds.add(detection.getTrackId());
            Optional<CrossingDirection> crossing = lineCounter.checkCrossing(detection.getTrackId(), detection.getBbox());
            if (crossing.isEmpty()) continue;

            if (crossing.get() == CrossingDirection.ENTRY) {
                result.entries++;
                log.debug("➡️ 进入: 轨迹 #{}", detection.getTrackId());
            } else {
                result.exits++;
                log.debug("⬅️ 离开: 轨迹 #{}", detection.getTrackId());
            }
        }
        lineCounter.retainTracks(activeIds);
    }

    /**
     * 过滤无效检测，null视为无检测
     */
    private List<Detection> sanitize(List<Detection> detections) {
        if (detections == null || detections.isEmpty()) {
            return List.of();
        }
        List<Detection> valid = new ArrayList<>(detections.size());
        for (Detection detection : detections) {
            if (detection != null && detection.isValid()) {
                valid.add(detection);
            }
        }
        if (valid.size() < detections.size()) {
            log.debug("忽略{}个无效检测", detections.size() - valid.size());
        }
        return valid;
    }

    private void commit(FrameResult result, long elapsedNanos) {
        currentCount.set(result.count);
        if (result.entries > 0) {
            totalEntries.addAndGet(result.entries);
            uniqueVisitors.addAndGet(result.entries);
        }
        if (result.exits > 0) {
            totalExits.addAndGet(result.exits);
        }
        fps = elapsedNanos > 0 ? 1_000_000_000.0 / elapsedNanos : 0.0;

        CrowdAnalysis previous = lastCrowdAnalysis;
        if (result.crowd.isInCrowdMode() && (previous == null || !previous.isInCrowdMode())) {
            log.info("👥 切换到人群模式 - 估计人数 {}", result.crowd.getEstimatedCount());
        } else if (!result.crowd.isInCrowdMode() && previous != null && previous.isInCrowdMode()) {
            log.info("🚶 恢复跟踪模式");
        }
        lastCrowdAnalysis = result.crowd;
    }

    /**
     * 生成当前快照，可在任意线程调用
     */
    public AnalyticsSnapshot snapshot() {
        Map<String, AnalyticsSnapshot.ZoneView> zoneViews = new LinkedHashMap<>();
        for (Zone zone : zones) {
            ZoneOccupancy occupancy = zoneAggregator.occupancy(zone.getId());
            zoneViews.put(zone.getId(), AnalyticsSnapshot.ZoneView.builder()
                    .name(zone.getName())
                    .type(zone.getType())
                    .count(occupancy.getCount())
                    .rollingAverage(occupancy.getRollingAverage())
                    .capacity(zone.getCapacity())
                    .occupancyPercent(zone.occupancyPercent(occupancy.getCount()))
                    .build());
        }

        CrowdAnalysis crowd = lastCrowdAnalysis;
        int count = currentCount.get();
        boolean crowdMode = crowd != null && crowd.isInCrowdMode();

        return AnalyticsSnapshot.builder()
                .currentCount(count)
                .totalEntries(totalEntries.get())
                .totalExits(totalExits.get())
                .uniqueVisitors(uniqueVisitors.get())
                .fps(fps)
                .zones(zoneViews)
                .mode(crowdMode ? AnalysisMode.CROWD : AnalysisMode.TRACKING)
                .crowdMode(crowdMode)
                .crowdConfidence(crowd != null ? crowd.getConfidence() : 0.0)
                .densityLevel(crowd != null ? crowd.getDensityLevel() : DensityLevel.fromCount(count))
                .framesProcessed(framesProcessed.get())
                .framesDropped(framesDropped.get())
                .framesFailed(framesFailed.get())
                .timestamp(LocalDateTime.now())
                .build();
    }

    // 配置与重置

    /**
     * 清空全部计数与跟踪状态；处理中时在当前帧结束后执行
     */
    public void reset() {
        pendingReset.set(true);
        applyWhenIdle();
    }

    /**
     * 替换计数线，会丢弃所有进行中的越线
     */
    public void setCountingLine(CountingLine line) {
        if (line.isDegenerate()) {
            throw new IllegalArgumentException("计数线两个端点不能重合");
        }
        pendingLine.set(line);
        applyWhenIdle();
    }

    public void setZones(List<Zone> newZones) {
        for (Zone zone : newZones) {
            if (zone.getId() == null || zone.getId().isBlank()) {
                throw new IllegalArgumentException("区域ID不能为空");
            }
            if (zone.getPoints().size() < 3) {
                throw new IllegalArgumentException("区域至少需要3个顶点: " + zone.getId());
            }
        }
        pendingZones.set(List.copyOf(newZones));
        applyWhenIdle();
    }

    public void updateThresholds(Thresholds newThresholds) {
        newThresholds.validate();
        pendingThresholds.set(newThresholds);
        applyWhenIdle();
    }

    public List<Zone> getZones() {
        return zones;
    }

    public CountingLine getCountingLine() {
        CountingLine pending = pendingLine.get();
        return pending != null ? pending : lineCounter.getCountingLine();
    }

    public Thresholds getThresholds() {
        return thresholds;
    }

    private void applyWhenIdle() {
        if (processing.compareAndSet(false, true)) {
            releaseAndApplyPending();
        }
    }

    /**
     * 在持有处理标志时应用暂存变更，然后释放标志；释放后若又有新变更则再尝试一次
     */
    private void releaseAndApplyPending() {
        try {
            applyPendingChanges();
        } finally {
            processing.set(false);
        }
        if (hasPendingChanges() && processing.compareAndSet(false, true)) {
            releaseAndApplyPending();
        }
    }

    private boolean hasPendingChanges() {
        return pendingReset.get() || pendingLine.get() != null
                || pendingZones.get() != null || pendingThresholds.get() != null;
    }

    private void applyPendingChanges() {
        Thresholds newThresholds = pendingThresholds.getAndSet(null);
        if (newThresholds != null) {
            tracker.reconfigure(newThresholds.getTrackThresh(), newThresholds.getMatchThresh(),
                    newThresholds.getTrackBuffer());
            crowdEstimator.reconfigure(newThresholds.getCrowdModeThreshold(),
                    newThresholds.getHighDensityThreshold());
            thresholds = newThresholds;
            log.info("⚙️ 阈值已更新: {}", newThresholds);
        }

        List<Zone> newZones = pendingZones.getAndSet(null);
        if (newZones != null) {
            zones = newZones;
            log.info("🗺️ 区域已更新，共{}个", newZones.size());
        }

        CountingLine newLine = pendingLine.getAndSet(null);
        if (newLine != null) {
            lineCounter.setCountingLine(newLine);
        }

        if (pendingReset.getAndSet(false)) {
            currentCount.set(0);
            totalEntries.set(0);
            totalExits.set(0);
            uniqueVisitors.set(0);
            tracker.reset();
            lineCounter.reset();
            zoneAggregator.reset();
            crowdEstimator.reset();
            lastCrowdAnalysis = null;
            fps = 0.0;
            log.info("🔄 计数已重置");
        }
    }

    @Override
    public void destroy() {
        worker.dispose();
        log.info("🏁 客流分析已停止，共处理{}帧", framesProcessed.get());
    }

    /**
     * 单帧的中间结果，帧处理成功后才提交到计数器
     */
    private static class FrameResult {
        private final CrowdAnalysis crowd;
        private int count;
        private int entries;
        private int exits;

        FrameResult(CrowdAnalysis crowd) {
            this.crowd = crowd;
        }
    }
}
