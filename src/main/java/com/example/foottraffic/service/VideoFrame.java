package com.example.foottraffic.service;

import com.example.foottraffic.analysis.FrameImage;
import com.example.foottraffic.tracking.Detection;
import lombok.Value;

import java.util.List;

/**
 * 待分析的一帧
 */
@Value
public class VideoFrame {

    /**
     * 帧像素，外部只提供检测结果时为null
     */
    FrameImage image;

    int width;
    int height;

    /**
     * 外部检测器已经给出的检测结果，可为null
     */
    List<Detection> detections;

    public static VideoFrame of(FrameImage image, List<Detection> detections) {
        return new VideoFrame(image, image.getWidth(), image.getHeight(), detections);
    }

    public static VideoFrame detectionsOnly(int width, int height, List<Detection> detections) {
        return new VideoFrame(null, width, height, detections);
    }
}
