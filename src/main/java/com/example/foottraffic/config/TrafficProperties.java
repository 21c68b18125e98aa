package com.example.foottraffic.config;

import com.example.foottraffic.analysis.CountingLine;
import com.example.foottraffic.analysis.Point;
import com.example.foottraffic.analysis.Zone;
import com.example.foottraffic.analysis.ZoneType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 客流分析配置，前缀 traffic
 */
@Data
@ConfigurationProperties(prefix = "traffic")
public class TrafficProperties {

    private Tracker tracker = new Tracker();
    private Crowd crowd = new Crowd();
    private Line line = new Line();
    private List<ZoneConfig> zones = new ArrayList<>();
    private Publish publish = new Publish();

    @Data
    public static class Tracker {
        /** 高/低置信度分界 */
        private double trackThresh = 0.5;
        /** 可接受的最大匹配代价 1 − IoU */
        private double matchThresh = 0.8;
        /** 丢失轨迹保留帧数 */
        private int trackBuffer = 30;
    }

    @Data
    public static class Crowd {
        /** 检测人数超过该值进入人群模式 */
        private int crowdModeThreshold = 20;
        /** 快速密度超过该值进入人群模式 */
        private double highDensityThreshold = 0.7;
        /** 人群模式下检测人数低于该值时仍尝试跟踪 */
        private int trackableLimit = 50;
    }

    @Data
    public static class Line {
        private double startX = 0;
        private double startY = 540;
        private double endX = 1920;
        private double endY = 540;

        public CountingLine toCountingLine() {
            return new CountingLine(startX, startY, endX, endY);
        }
    }

    @Data
    public static class ZoneConfig {
        private String id;
        private String name;
        /** 顶点列表，每项为 [x, y] */
        private List<List<Double>> points = new ArrayList<>();
        private int capacity = 50;
        private ZoneType type = ZoneType.COUNTING;

        public Zone toZone() {
            List<Point> vertices = new ArrayList<>();
            for (List<Double> p : points) {
                if (p == null || p.size() < 2 || p.get(0) == null || p.get(1) == null) {
                    throw new IllegalArgumentException("顶点格式应为 [x, y]: " + id);
                }
                vertices.add(new Point(p.get(0), p.get(1)));
            }
            return new Zone(id, name, vertices, capacity, type);
        }
    }

    @Data
    public static class Publish {
        /** 快照推送间隔（毫秒） */
        private long intervalMs = 1000;
    }

    /**
     * 配置的区域；未配置时使用默认区域
     */
    public List<Zone> toZones() {
        if (zones.isEmpty()) {
            return List.of(Zone.defaultZone());
        }
        List<Zone> result = new ArrayList<>();
        for (ZoneConfig config : zones) {
            result.add(config.toZone());
        }
        return result;
    }
}
