package com.example.foottraffic.dto;

import lombok.Data;

@Data
public class DetectionRequest {

    private Double left;
    private Double top;
    private Double right;
    private Double bottom;

    /**
     * 置信度 (0.0-1.0)
     */
    private Double confidence;

    /**
     * 类别ID
     */
    private Integer classId = 0;
}
