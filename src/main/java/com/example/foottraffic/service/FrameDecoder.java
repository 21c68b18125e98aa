package com.example.foottraffic.service;

import com.example.foottraffic.analysis.FrameImage;
import com.example.foottraffic.dto.DetectionRequest;
import com.example.foottraffic.dto.FrameRequest;
import com.example.foottraffic.tracking.BoundingBox;
import com.example.foottraffic.tracking.Detection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * 把帧请求转换为 {@link VideoFrame}
 */
@Slf4j
@Component
public class FrameDecoder {

    public VideoFrame decode(FrameRequest request) {
        List<Detection> detections = toDetections(request.getDetections());

        if (request.getImage() == null || request.getImage().isBlank()) {
            int width = request.getWidth() != null ? request.getWidth() : 0;
            int height = request.getHeight() != null ? request.getHeight() : 0;
            return VideoFrame.detectionsOnly(width, height, detections);
        }

        return VideoFrame.of(decodeImage(request.getImage()), detections);
    }

    FrameImage decodeImage(String base64) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("图像不是有效的Base64编码", e);
        }

        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw new IllegalArgumentException("图像解码失败: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new IllegalArgumentException("不支持的图像格式");
        }
        return FrameImage.fromBufferedImage(image);
    }

    /**
     * 缺少字段的检测直接丢弃
     */
    private List<Detection> toDetections(List<DetectionRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        List<Detection> detections = new ArrayList<>(requests.size());
        for (DetectionRequest r : requests) {
            if (r == null || r.getLeft() == null || r.getTop() == null
                    || r.getRight() == null || r.getBottom() == null || r.getConfidence() == null) {
                log.debug("忽略字段不完整的检测: {}", r);
                continue;
            }
            detections.add(Detection.of(
                    new BoundingBox(r.getLeft(), r.getTop(), r.getRight(), r.getBottom()),
                    r.getConfidence(),
                    r.getClassId() != null ? r.getClassId() : 0));
        }
        return detections;
    }
}
