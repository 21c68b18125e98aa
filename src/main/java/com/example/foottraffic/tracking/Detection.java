package com.example.foottraffic.tracking;

import lombok.Value;
import lombok.With;

/**
 * 单帧检测结果
 */
@Value
@With
public class Detection {

    public static final int UNASSIGNED = -1;

    BoundingBox bbox;
    double confidence;
    int classId;

    /**
     * 跟踪ID，未分配时为-1
     */
    int trackId;

    public static Detection of(BoundingBox bbox, double confidence, int classId) {
        return new Detection(bbox, confidence, classId, UNASSIGNED);
    }

    public static Detection of(double left, double top, double right, double bottom, double confidence) {
        return of(new BoundingBox(left, top, right, bottom), confidence, 0);
    }

    public boolean isValid() {
        return bbox != null && bbox.isValid() && Double.isFinite(confidence);
    }
}
