package com.example.foottraffic.analysis;

import lombok.Value;

/**
 * 人群密度分析结果
 */
@Value
public class CrowdAnalysis {

    int estimatedCount;
    DensityLevel densityLevel;

    /**
     * 密度热力图，[行][列]
     */
    float[][] densityMap;

    /**
     * 估计置信度，人群模式下在 [0.3, 0.9] 之间
     */
    double confidence;

    boolean inCrowdMode;

    public AnalysisMode getMode() {
        return inCrowdMode ? AnalysisMode.CROWD : AnalysisMode.TRACKING;
    }
}
