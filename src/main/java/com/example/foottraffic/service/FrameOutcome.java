package com.example.foottraffic.service;

/**
 * 单帧处理结果
 */
public enum FrameOutcome {
    /** 已处理 */
    PROCESSED,
    /** 上一帧仍在处理，本帧被丢弃 */
    DROPPED,
    /** 处理出错，本帧被跳过 */
    FAILED
}
