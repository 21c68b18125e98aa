package com.example.foottraffic.service;

import com.example.foottraffic.tracking.Detection;

import java.util.List;

/**
 * 行人检测器，模型本身在本服务之外
 */
public interface PersonDetector {

    /**
     * 检测一帧中的行人
     *
     * @return 检测结果，trackId均为-1；可返回null或空列表表示无检测
     */
    List<Detection> detect(VideoFrame frame);
}
