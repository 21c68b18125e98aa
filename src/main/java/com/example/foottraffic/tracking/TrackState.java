package com.example.foottraffic.tracking;

/**
 * 轨迹生命周期
 * <p>
 * NEW → TRACKED ⇄ LOST → REMOVED，REMOVED为终态，不会复活。
 */
public enum TrackState {
    /** 刚创建，尚未再次匹配 */
    NEW,
    /** 本帧匹配成功 */
    TRACKED,
    /** 本帧未匹配，仍在缓冲期内 */
    LOST,
    /** 超过缓冲期被移除 */
    REMOVED
}
