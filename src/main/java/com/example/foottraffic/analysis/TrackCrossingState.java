package com.example.foottraffic.analysis;

import com.example.foottraffic.util.RingBuffer;

/**
 * 单个轨迹的越线状态
 * <p>
 * {@code hasCrossed} 置位后不会复位，只能通过重置计数线清除整个状态。
 */
public class TrackCrossingState {

    public static final int POSITION_CAPACITY = 10;

    private final int trackId;
    private final RingBuffer<double[]> positions = new RingBuffer<>(POSITION_CAPACITY);
    private boolean hasCrossed;
    private CrossingDirection direction;

    TrackCrossingState(int trackId) {
        this.trackId = trackId;
    }

    void addPosition(double x, double y) {
        positions.add(new double[]{x, y});
    }

    void markCrossed(CrossingDirection direction) {
        this.hasCrossed = true;
        this.direction = direction;
    }

    RingBuffer<double[]> positions() {
        return positions;
    }

    public int getTrackId() {
        return trackId;
    }

    public boolean hasCrossed() {
        return hasCrossed;
    }

    public CrossingDirection getDirection() {
        return direction;
    }

    public int getPositionCount() {
        return positions.size();
    }
}
