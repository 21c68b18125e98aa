package com.example.foottraffic.service;

import com.example.foottraffic.config.TrafficProperties;
import lombok.Value;

/**
 * 运行时可调整的阈值
 */
@Value
public class Thresholds {

    double trackThresh;
    double matchThresh;
    int trackBuffer;
    int crowdModeThreshold;
    double highDensityThreshold;

    public static Thresholds from(TrafficProperties properties) {
        return new Thresholds(
                properties.getTracker().getTrackThresh(),
                properties.getTracker().getMatchThresh(),
                properties.getTracker().getTrackBuffer(),
                properties.getCrowd().getCrowdModeThreshold(),
                properties.getCrowd().getHighDensityThreshold());
    }

    /**
     * 校验取值范围
     */
    public void validate() {
        if (trackThresh < 0 || trackThresh > 1) {
            throw new IllegalArgumentException("trackThresh 必须在 [0, 1] 内: " + trackThresh);
        }
        if (matchThresh <= 0 || matchThresh > 1) {
            throw new IllegalArgumentException("matchThresh 必须在 (0, 1] 内: " + matchThresh);
        }
        if (trackBuffer < 0) {
            throw new IllegalArgumentException("trackBuffer 不能为负: " + trackBuffer);
        }
        if (crowdModeThreshold < 0) {
            throw new IllegalArgumentException("crowdModeThreshold 不能为负: " + crowdModeThreshold);
        }
        if (highDensityThreshold < 0) {
            throw new IllegalArgumentException("highDensityThreshold 不能为负: " + highDensityThreshold);
        }
    }
}
