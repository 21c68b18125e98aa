package com.example.foottraffic.dto;

import com.example.foottraffic.analysis.ZoneType;
import lombok.Data;

import java.util.List;

@Data
public class ZoneRequest {

    /**
     * 区域ID
     */
    private String id;

    /**
     * 区域名称
     */
    private String name;

    /**
     * 多边形顶点，每项为 [x, y]
     */
    private List<List<Double>> points;

    /**
     * 容量
     */
    private Integer capacity = 50;

    /**
     * 区域类型: COUNTING, ENTRY, EXIT, EXCLUSION
     */
    private ZoneType type = ZoneType.COUNTING;
}
