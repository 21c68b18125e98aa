package com.example.foottraffic.controller;

import com.example.foottraffic.analysis.CountingLine;
import com.example.foottraffic.analysis.Point;
import com.example.foottraffic.analysis.Zone;
import com.example.foottraffic.dto.AnalyticsSnapshot;
import com.example.foottraffic.dto.CountingLineRequest;
import com.example.foottraffic.dto.FrameRequest;
import com.example.foottraffic.dto.ThresholdsRequest;
import com.example.foottraffic.dto.ZoneRequest;
import com.example.foottraffic.service.AnalyticsPublisher;
import com.example.foottraffic.service.FrameDecoder;
import com.example.foottraffic.service.FrameOutcome;
import com.example.foottraffic.service.Thresholds;
import com.example.foottraffic.service.TrafficAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/traffic")
@RequiredArgsConstructor
@CrossOrigin(origins = "*", allowedHeaders = "*")
public class TrafficController {

    private final TrafficAnalyzer trafficAnalyzer;
    private final AnalyticsPublisher analyticsPublisher;
    private final FrameDecoder frameDecoder;

    /**
     * 提交一帧检测结果（可附带帧图像）
     */
    @PostMapping("/frames")
    public Mono<ResponseEntity<Map<String, Object>>> submitFrame(@RequestBody FrameRequest request) {
        return Mono.fromCallable(() -> frameDecoder.decode(request))
                .flatMap(trafficAnalyzer::submitFrame)
                .map(outcome -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", outcome != FrameOutcome.FAILED);
                    response.put("accepted", outcome != FrameOutcome.DROPPED);
                    response.put("outcome", outcome);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> {
                    log.warn("帧提交失败: {}", ex.getMessage());
                    return Mono.just(ResponseEntity.badRequest().body(errorBody(ex)));
                });
    }

    /**
     * 获取当前快照
     */
    @GetMapping("/snapshot")
    public Mono<AnalyticsSnapshot> getSnapshot() {
        return Mono.fromCallable(trafficAnalyzer::snapshot);
    }

    /**
     * 快照推送 (Server-Sent Events)
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<AnalyticsSnapshot>> streamSnapshots() {
        log.info("📡 客户端订阅快照流");

        return analyticsPublisher.stream()
                .map(snapshot -> ServerSentEvent.<AnalyticsSnapshot>builder()
                        .event("snapshot")
                        .data(snapshot)
                        .build())
                .doOnCancel(() -> log.info("📡 客户端取消快照订阅"))
                .doOnError(error -> log.error("📡 快照推送错误: {}", error.getMessage()));
    }

    /**
     * 重置计数
     */
    @PostMapping("/reset")
    public Mono<ResponseEntity<Map<String, Object>>> reset() {
        return Mono.fromCallable(() -> {
            trafficAnalyzer.reset();

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("message", "计数已重置");
            return ResponseEntity.ok(response);
        });
    }

    @GetMapping("/line")
    public Mono<CountingLine> getCountingLine() {
        return Mono.fromCallable(trafficAnalyzer::getCountingLine);
    }

    /**
     * 设置计数线
     */
    @PutMapping("/line")
    public Mono<ResponseEntity<Map<String, Object>>> setCountingLine(@RequestBody CountingLineRequest request) {
        return Mono.fromCallable(() -> {
                    validateLineRequest(request);
                    CountingLine line = new CountingLine(request.getStartX(), request.getStartY(),
                            request.getEndX(), request.getEndY());
                    trafficAnalyzer.setCountingLine(line);

                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("line", line);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> {
                    log.error("设置计数线失败: {}", ex.getMessage());
                    return Mono.just(ResponseEntity.badRequest().body(errorBody(ex)));
                });
    }

    @GetMapping("/zones")
    public Mono<List<Zone>> getZones() {
        return Mono.fromCallable(trafficAnalyzer::getZones);
    }

    /**
     * 替换全部区域
     */
    @PutMapping("/zones")
    public Mono<ResponseEntity<Map<String, Object>>> setZones(@RequestBody List<ZoneRequest> requests) {
        return Mono.fromCallable(() -> {
                    List<Zone> zones = new ArrayList<>();
                    for (ZoneRequest request : requests) {
                        zones.add(toZone(request));
                    }
                    trafficAnalyzer.setZones(zones);

                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("zoneCount", zones.size());
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> {
                    log.error("设置区域失败: {}", ex.getMessage());
                    return Mono.just(ResponseEntity.badRequest().body(errorBody(ex)));
                });
    }

    /**
     * 调整阈值，未给出的字段保持不变
     */
    @PutMapping("/thresholds")
    public Mono<ResponseEntity<Map<String, Object>>> updateThresholds(@RequestBody ThresholdsRequest request) {
        return Mono.fromCallable(() -> {
                    Thresholds current = trafficAnalyzer.getThresholds();
                    Thresholds updated = new Thresholds(
                            request.getTrackThresh() != null ? request.getTrackThresh() : current.getTrackThresh(),
                            request.getMatchThresh() != null ? request.getMatchThresh() : current.getMatchThresh(),
                            request.getTrackBuffer() != null ? request.getTrackBuffer() : current.getTrackBuffer(),
                            request.getCrowdModeThreshold() != null
                                    ? request.getCrowdModeThreshold() : current.getCrowdModeThreshold(),
                            request.getHighDensityThreshold() != null
                                    ? request.getHighDensityThreshold() : current.getHighDensityThreshold());
                    trafficAnalyzer.updateThresholds(updated);

                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("thresholds", updated);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> {
                    log.error("调整阈值失败: {}", ex.getMessage());
                    return Mono.just(ResponseEntity.badRequest().body(errorBody(ex)));
                });
    }

    // 私有方法

    private void validateLineRequest(CountingLineRequest request) {
        if (request.getStartX() == null || request.getStartY() == null
                || request.getEndX() == null || request.getEndY() == null) {
            throw new IllegalArgumentException("计数线端点不能为空");
        }
    }

    private Zone toZone(ZoneRequest request) {
        if (request.getId() == null || request.getId().trim().isEmpty()) {
            throw new IllegalArgumentException("区域ID不能为空");
        }
        if (request.getPoints() == null || request.getPoints().size() < 3) {
            throw new IllegalArgumentException("区域至少需要3个顶点: " + request.getId());
        }

        List<Point> points = new ArrayList<>();
        for (List<Double> p : request.getPoints()) {
            if (p == null || p.size() < 2 || p.get(0) == null || p.get(1) == null) {
                throw new IllegalArgumentException("顶点格式应为 [x, y]: " + request.getId());
            }
            points.add(new Point(p.get(0), p.get(1)));
        }

        String name = request.getName() != null ? request.getName() : request.getId();
        int capacity = request.getCapacity() != null ? request.getCapacity() : 0;
        if (capacity < 0) {
            throw new IllegalArgumentException("区域容量不能为负: " + request.getId());
        }
        return new Zone(request.getId(), name, points, capacity, request.getType());
    }

    private Map<String, Object> errorBody(Throwable ex) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("success", false);
        errorResponse.put("error", ex.getMessage());
        return errorResponse;
    }
}
