package com.example.foottraffic.service;

import com.example.foottraffic.tracking.Detection;

import java.util.List;

/**
 * 默认检测器：直接使用随帧提交的检测结果
 */
public class AttachedDetectionsDetector implements PersonDetector {

    @Override
    public List<Detection> detect(VideoFrame frame) {
        return frame.getDetections() == null ? List.of() : frame.getDetections();
    }
}
