package com.example.foottraffic.tracking;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 两级置信度的多目标跟踪器
 * <p>
 * 每帧先用高置信度检测匹配全部轨迹，再用低置信度检测找回未匹配的轨迹，
 * 剩余高置信度检测创建新轨迹，超过缓冲帧数未匹配的轨迹被永久移除。
 * 只允许单线程调用，不可重入。
 */
@Slf4j
public class ByteTracker {

    public static final double DEFAULT_TRACK_THRESH = 0.5;
    public static final double DEFAULT_MATCH_THRESH = 0.8;
    public static final int DEFAULT_TRACK_BUFFER = 30;

    // 按创建顺序保存，输出顺序与ID顺序一致
    private final Map<Integer, Track> tracks = new LinkedHashMap<>();

    private double trackThresh;
    private int trackBuffer;
    private IouMatcher matcher;

    private int nextTrackId = 1;
    private long frameId;

    public ByteTracker() {
        this(DEFAULT_TRACK_THRESH, DEFAULT_MATCH_THRESH, DEFAULT_TRACK_BUFFER);
    }

    public ByteTracker(double trackThresh, double matchThresh, int trackBuffer) {
        reconfigure(trackThresh, matchThresh, trackBuffer);
    }

    /**
     * 更新阈值，只能在两帧之间调用
     */
    public void reconfigure(double trackThresh, double matchThresh, int trackBuffer) {
        this.trackThresh = trackThresh;
        this.trackBuffer = trackBuffer;
        this.matcher = new IouMatcher(matchThresh);
    }

    /**
     * 处理一帧检测，返回全部存活轨迹（以带跟踪ID的检测形式）
     */
    public List<Detection> update(List<Detection> detections) {
        frameId++;

        for (Track track : tracks.values()) {
            track.predict();
        }

        List<Detection> highConf = new ArrayList<>();
        List<Detection> lowConf = new ArrayList<>();
        for (Detection detection : detections) {
            if (detection.getConfidence() >= trackThresh) {
                highConf.add(detection);
            } else {
                lowConf.add(detection);
            }
        }

        IouMatcher.Association first = matcher.match(new ArrayList<>(tracks.values()), highConf);
        for (IouMatcher.Match match : first.getMatches()) {
            match.getTrack().update(match.getDetection());
        }

        // 低置信度检测只用于找回轨迹，不创建新轨迹
        List<Track> remaining = first.getUnmatchedTracks();
        if (!lowConf.isEmpty() && !remaining.isEmpty()) {
            IouMatcher.Association second = matcher.match(remaining, lowConf);
            for (IouMatcher.Match match : second.getMatches()) {
                match.getTrack().update(match.getDetection());
            }
            remaining = second.getUnmatchedTracks();
        }

        for (Detection detection : first.getUnmatchedDetections()) {
            Track track = new Track(nextTrackId++, detection);
            tracks.put(track.getTrackId(), track);
        }

        for (Track track : remaining) {
            if (track.getTimeSinceUpdate() > trackBuffer) {
                track.markRemoved();
                tracks.remove(track.getTrackId());
                log.debug("🗑️ 移除轨迹 #{} - 丢失{}帧", track.getTrackId(), track.getTimeSinceUpdate());
            }
        }

        List<Detection> output = new ArrayList<>(tracks.size());
        for (Track track : tracks.values()) {
            output.add(track.toDetection());
        }
        return output;
    }

    public List<Track> getTracks() {
        return new ArrayList<>(tracks.values());
    }

    public long getFrameId() {
        return frameId;
    }

    /**
     * 清空全部轨迹，ID序列继续递增，不会重复使用
     */
    public void reset() {
        Iterator<Track> iterator = tracks.values().iterator();
        while (iterator.hasNext()) {
            iterator.next().markRemoved();
            iterator.remove();
        }
        frameId = 0;
    }

    public double getTrackThresh() {
        return trackThresh;
    }

    public double getMatchThresh() {
        return matcher.getMatchThresh();
    }

    public int getTrackBuffer() {
        return trackBuffer;
    }
}
