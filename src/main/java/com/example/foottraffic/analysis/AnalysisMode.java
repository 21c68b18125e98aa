package com.example.foottraffic.analysis;

/**
 * 分析模式：逐个跟踪或人群密度估计
 * <p>
 * 进入人群模式的条件：原始检测数超过人群阈值，或快速密度超过高密度阈值。
 * 每帧重新判断，条件不满足即回到跟踪模式。
 */
public enum AnalysisMode {
    TRACKING,
    CROWD;

    public static AnalysisMode select(int detectorCount, int crowdModeThreshold,
                                      double quickDensity, double highDensityThreshold) {
        if (detectorCount > crowdModeThreshold) return CROWD;
        if (quickDensity > highDensityThreshold) return CROWD;
        return TRACKING;
    }
}
