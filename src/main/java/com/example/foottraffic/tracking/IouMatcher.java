package com.example.foottraffic.tracking;

import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 基于IoU代价的贪心匹配
 * <p>
 * 代价为 {@code 1 − IoU}，只保留代价小于阈值的候选对，按代价升序（稳定排序，
 * 相同代价按轨迹、检测的输入顺序）逐个接受两侧都未被占用的候选对。
 * 结果是确定的，但不保证全局最优。
 */
public class IouMatcher {

    private final double matchThresh;

    public IouMatcher(double matchThresh) {
        this.matchThresh = matchThresh;
    }

    public Association match(List<Track> tracks, List<Detection> detections) {
        if (tracks.isEmpty() || detections.isEmpty()) {
            return new Association(List.of(), new ArrayList<>(tracks), new ArrayList<>(detections));
        }

        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < tracks.size(); i++) {
            BoundingBox trackBox = tracks.get(i).getBbox();
            for (int j = 0; j < detections.size(); j++) {
                double cost = 1.0 - trackBox.iou(detections.get(j).getBbox());
                if (cost < matchThresh) {
                    candidates.add(new Candidate(i, j, cost));
                }
            }
        }
        candidates.sort(Comparator.comparingDouble(Candidate::getCost));

        boolean[] usedTracks = new boolean[tracks.size()];
        boolean[] usedDetections = new boolean[detections.size()];
        List<Match> matches = new ArrayList<>();

        for (Candidate candidate : candidates) {
            if (!usedTracks[candidate.getTrackIndex()] && !usedDetections[candidate.getDetectionIndex()]) {
                matches.add(new Match(tracks.get(candidate.getTrackIndex()), detections.get(candidate.getDetectionIndex())));
                usedTracks[candidate.getTrackIndex()] = true;
                usedDetections[candidate.getDetectionIndex()] = true;
            }
        }

        List<Track> unmatchedTracks = new ArrayList<>();
        for (int i = 0; i < tracks.size(); i++) {
            if (!usedTracks[i]) unmatchedTracks.add(tracks.get(i));
        }
        List<Detection> unmatchedDetections = new ArrayList<>();
        for (int j = 0; j < detections.size(); j++) {
            if (!usedDetections[j]) unmatchedDetections.add(detections.get(j));
        }

        return new Association(matches, unmatchedTracks, unmatchedDetections);
    }

    public double getMatchThresh() {
        return matchThresh;
    }

    @Value
    private static class Candidate {
        int trackIndex;
        int detectionIndex;
        double cost;
    }

    /**
     * 匹配成功的轨迹与检测
     */
    @Value
    public static class Match {
        Track track;
        Detection detection;
    }

    /**
     * 一轮匹配的结果
     */
    @Value
    public static class Association {
        List<Match> matches;
        List<Track> unmatchedTracks;
        List<Detection> unmatchedDetections;
    }
}
