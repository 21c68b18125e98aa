package com.example.foottraffic.analysis;

import com.example.foottraffic.tracking.BoundingBox;
import com.example.foottraffic.tracking.Detection;
import com.example.foottraffic.util.RingBuffer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 区域人数统计
 * <p>
 * 单写多读：只有处理线程调用 {@code update*}，其他线程通过 {@link #occupancy(String)}
 * 读取每次更新后整体替换的不可变 {@link ZoneOccupancy}，不会读到写了一半的状态。
 * 已删除区域的ID不会被自动清理，只是不再更新。
 */
public class ZoneAggregator {

    public static final int HISTORY_CAPACITY = 30;

    /**
     * 人群模式下密度到人数的换算系数
     */
    static final double CROWD_ZONE_FACTOR = 2.0;

    private final Map<String, ZoneOccupancy> occupancies = new ConcurrentHashMap<>();

    // 只由写线程访问
    private final Map<String, RingBuffer<Integer>> histories = new HashMap<>();

    /**
     * 记录区域当前人数并更新滚动平均
     */
    public void update(String zoneId, int count) {
        RingBuffer<Integer> history = histories.computeIfAbsent(zoneId, id -> new RingBuffer<>(HISTORY_CAPACITY));
        history.add(count);

        long sum = 0;
        for (int i = 0; i < history.size(); i++) {
            sum += history.get(i);
        }
        double average = (double) sum / history.size();

        occupancies.put(zoneId, new ZoneOccupancy(zoneId, count, average, history.size()));
    }

    /**
     * 按轨迹中心点统计每个区域的人数
     */
    public void updateFromTracks(List<Zone> zones, List<Detection> tracked) {
        for (Zone zone : zones) {
            int count = 0;
            for (Detection detection : tracked) {
                BoundingBox bbox = detection.getBbox();
                if (zone.contains(bbox.getCenterX(), bbox.getCenterY())) {
                    count++;
                }
            }
            update(zone.getId(), count);
        }
    }

    /**
     * 人群模式下用密度网格近似区域人数
     * <p>
     * 取中心点落在多边形内的网格单元的平均密度，乘以区域容量和固定系数。
     */
    public void updateFromDensityMap(List<Zone> zones, float[][] densityMap, int frameWidth, int frameHeight) {
        for (Zone zone : zones) {
            update(zone.getId(), estimateFromDensityMap(zone, densityMap, frameWidth, frameHeight));
        }
    }

    static int estimateFromDensityMap(Zone zone, float[][] densityMap, int frameWidth, int frameHeight) {
        int rows = densityMap.length;
        if (rows == 0 || frameWidth <= 0 || frameHeight <= 0) return 0;
        int cols = densityMap[0].length;
        if (cols == 0) return 0;

        double cellWidth = (double) frameWidth / cols;
        double cellHeight = (double) frameHeight / rows;

        double sum = 0;
        int cellsInside = 0;
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                double cx = (col + 0.5) * cellWidth;
                double cy = (row + 0.5) * cellHeight;
                if (zone.contains(cx, cy)) {
                    sum += densityMap[row][col];
                    cellsInside++;
                }
            }
        }
        if (cellsInside == 0) return 0;

        return (int) Math.round(sum / cellsInside * zone.getCapacity() * CROWD_ZONE_FACTOR);
    }

    public ZoneOccupancy occupancy(String zoneId) {
        return occupancies.getOrDefault(zoneId, ZoneOccupancy.empty(zoneId));
    }

    public Map<String, ZoneOccupancy> getAll() {
        return Map.copyOf(occupancies);
    }

    public void reset() {
        occupancies.clear();
        histories.clear();
    }
}
