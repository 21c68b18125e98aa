package com.example.foottraffic.analysis;

/**
 * 人群密度等级，由人数按 0/10/30/50 分段
 */
public enum DensityLevel {
    /** 0人 */
    EMPTY,
    /** 1-10人 */
    SPARSE,
    /** 11-30人 */
    MODERATE,
    /** 31-50人 */
    DENSE,
    /** 50人以上 */
    PACKED;

    public static DensityLevel fromCount(int count) {
        if (count <= 0) return EMPTY;
        if (count <= 10) return SPARSE;
        if (count <= 30) return MODERATE;
        if (count <= 50) return DENSE;
        return PACKED;
    }
}
