package com.example.foottraffic.analysis;

import com.example.foottraffic.tracking.BoundingBox;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 计数线越线检测
 * <p>
 * 每个轨迹最多触发一次越线事件。写入只来自处理线程，状态表可被其他线程并发读取。
 */
@Slf4j
public class LineCounter {

    private final Map<Integer, TrackCrossingState> trackStates = new ConcurrentHashMap<>();
    private volatile CountingLine countingLine;

    public LineCounter() {
        this(CountingLine.defaultLine());
    }

    public LineCounter(CountingLine countingLine) {
        this.countingLine = countingLine;
    }

    /**
     * 替换计数线，同时丢弃所有轨迹的越线历史（进行中的越线会丢失）
     */
    public void setCountingLine(CountingLine line) {
        this.countingLine = line;
        reset();
        log.info("📏 计数线已更新: ({}, {}) -> ({}, {})",
                line.getStartX(), line.getStartY(), line.getEndX(), line.getEndY());
    }

    /**
     * 记录轨迹当前位置并判断是否越线
     */
    public Optional<CrossingDirection> checkCrossing(int trackId, BoundingBox bbox) {
        TrackCrossingState state = trackStates.computeIfAbsent(trackId, TrackCrossingState::new);
        state.addPosition(bbox.getCenterX(), bbox.getCenterY());

        if (state.getPositionCount() < 2) return Optional.empty();
        if (state.hasCrossed()) return Optional.empty();

        double[] previous = state.positions().fromEnd(2);
        double[] current = state.positions().fromEnd(1);

        if (!isLineCrossed(previous, current, countingLine)) {
            return Optional.empty();
        }

        CrossingDirection direction = current[1] > previous[1] ? CrossingDirection.EXIT : CrossingDirection.ENTRY;
        state.markCrossed(direction);
        return Optional.of(direction);
    }

    private boolean isLineCrossed(double[] p1, double[] p2, CountingLine line) {
        double side1 = line.side(p1[0], p1[1]);
        double side2 = line.side(p2[0], p2[1]);
        // 严格异号，共线视为未越线
        return side1 * side2 < 0;
    }

    /**
     * 丢弃不再存活的轨迹状态
     */
    public void retainTracks(Set<Integer> activeTrackIds) {
        trackStates.keySet().retainAll(activeTrackIds);
    }

    public Optional<TrackCrossingState> getState(int trackId) {
        return Optional.ofNullable(trackStates.get(trackId));
    }

    public CountingLine getCountingLine() {
        return countingLine;
    }

    public void reset() {
        trackStates.clear();
    }
}
