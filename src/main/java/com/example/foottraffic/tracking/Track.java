package com.example.foottraffic.tracking;

import com.example.foottraffic.util.RingBuffer;

import java.util.List;

/**
 * 跟踪目标，只由 {@link ByteTracker} 修改
 */
public class Track {

    public static final int HISTORY_CAPACITY = 30;

    private final int trackId;
    private final MotionModel motionModel;
    private final RingBuffer<BoundingBox> history = new RingBuffer<>(HISTORY_CAPACITY);

    private BoundingBox bbox;
    private double confidence;
    private int classId;
    private int age;
    private int timeSinceUpdate;
    private boolean removed;

    Track(int trackId, Detection detection) {
        this.trackId = trackId;
        this.bbox = detection.getBbox();
        this.confidence = detection.getConfidence();
        this.classId = detection.getClassId();
        this.motionModel = new MotionModel(detection.getBbox());
        this.history.add(detection.getBbox());
    }

    void predict() {
        bbox = motionModel.predict();
        timeSinceUpdate++;
    }

    void update(Detection detection) {
        bbox = detection.getBbox();
        confidence = detection.getConfidence();
        classId = detection.getClassId();
        motionModel.correct(detection.getBbox());
        timeSinceUpdate = 0;
        age++;
        history.add(detection.getBbox());
    }

    void markRemoved() {
        removed = true;
    }

    public TrackState getState() {
        if (removed) return TrackState.REMOVED;
        if (timeSinceUpdate > 0) return TrackState.LOST;
        return age == 0 ? TrackState.NEW : TrackState.TRACKED;
    }

    /**
     * 以检测结果形式输出，附带跟踪ID，类别取最近一次匹配的检测
     */
    public Detection toDetection() {
        return new Detection(bbox, confidence, classId, trackId);
    }

    public int getTrackId() {
        return trackId;
    }

    public BoundingBox getBbox() {
        return bbox;
    }

    public double getConfidence() {
        return confidence;
    }

    public int getClassId() {
        return classId;
    }

    public int getAge() {
        return age;
    }

    public int getTimeSinceUpdate() {
        return timeSinceUpdate;
    }

    public MotionModel getMotionModel() {
        return motionModel;
    }

    public List<BoundingBox> getHistory() {
        return history.toList();
    }
}
