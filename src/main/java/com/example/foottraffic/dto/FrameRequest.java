package com.example.foottraffic.dto;

import lombok.Data;

import java.util.List;

@Data
public class FrameRequest {

    /**
     * 帧宽度（像素）
     */
    private Integer width = 1920;

    /**
     * 帧高度（像素）
     */
    private Integer height = 1080;

    /**
     * Base64编码的帧图像（PNG/JPEG，可选），人群密度估计需要
     */
    private String image;

    /**
     * 外部检测器给出的检测结果
     */
    private List<DetectionRequest> detections;
}
