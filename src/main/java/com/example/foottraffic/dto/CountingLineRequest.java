package com.example.foottraffic.dto;

import lombok.Data;

@Data
public class CountingLineRequest {

    private Double startX;
    private Double startY;
    private Double endX;
    private Double endY;
}
