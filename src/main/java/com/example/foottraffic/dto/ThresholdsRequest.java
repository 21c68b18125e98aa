package com.example.foottraffic.dto;

import lombok.Data;

/**
 * 阈值调整请求，未给出的字段保持当前值
 */
@Data
public class ThresholdsRequest {

    private Double trackThresh;
    private Double matchThresh;
    private Integer trackBuffer;
    private Integer crowdModeThreshold;
    private Double highDensityThreshold;
}
