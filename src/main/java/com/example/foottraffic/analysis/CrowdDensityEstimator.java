package com.example.foottraffic.analysis;

import com.example.foottraffic.util.RingBuffer;
import lombok.extern.slf4j.Slf4j;

/**
 * 人群密度估计，在目标过密无法逐个跟踪时使用
 * <p>
 * 先用稀疏采样的快速密度判断是否进入人群模式；进入后融合边缘、纹理、运动、前景四种信号，
 * 按密度选择每人像素数换算人数。各权重与换算系数为经验值，缺少标定数据前保持不变。
 * 有状态（上一帧与运动历史），只允许处理线程调用。
 */
@Slf4j
public class CrowdDensityEstimator {

    public static final int DEFAULT_CROWD_MODE_THRESHOLD = 20;
    public static final double DEFAULT_HIGH_DENSITY_THRESHOLD = 0.7;

    public static final int GRID_SIZE = 32;
    static final int MIN_EDGE_THRESHOLD = 50;
    static final int TEXTURE_WINDOW_SIZE = 16;
    static final int QUICK_SAMPLE_RATE = 10;
    static final int SAMPLE_RATE = 5;
    static final int MOTION_THRESHOLD = 30;
    static final int FOREGROUND_THRESHOLD = 30;
    static final int DARK_PIXEL_THRESHOLD = 100;
    static final int MOTION_HISTORY_SIZE = 10;

    static final double WEIGHT_EDGE = 0.30;
    static final double WEIGHT_TEXTURE = 0.25;
    static final double WEIGHT_MOTION = 0.20;
    static final double WEIGHT_FOREGROUND = 0.25;

    // 每人像素数，随摄像头高度和角度变化
    static final double PIXELS_PER_PERSON_SPARSE = 5000;
    static final double PIXELS_PER_PERSON_DENSE = 2500;
    static final double PIXELS_PER_PERSON_PACKED = 1500;

    static final double MIN_CONFIDENCE = 0.3;
    static final double MAX_CONFIDENCE = 0.9;
    static final double PASSTHROUGH_CONFIDENCE = 0.95;

    private int crowdModeThreshold;
    private double highDensityThreshold;

    private FrameImage previousFrame;
    private final RingBuffer<Double> motionHistory = new RingBuffer<>(MOTION_HISTORY_SIZE);

    public CrowdDensityEstimator() {
        this(DEFAULT_CROWD_MODE_THRESHOLD, DEFAULT_HIGH_DENSITY_THRESHOLD);
    }

    public CrowdDensityEstimator(int crowdModeThreshold, double highDensityThreshold) {
        reconfigure(crowdModeThreshold, highDensityThreshold);
    }

    public void reconfigure(int crowdModeThreshold, double highDensityThreshold) {
        this.crowdModeThreshold = crowdModeThreshold;
        this.highDensityThreshold = highDensityThreshold;
    }

    /**
     * 分析一帧
     *
     * @param frame         帧像素，可为null（此时只能按检测数判断模式）
     * @param detectorCount 检测器给出的原始人数
     */
    public CrowdAnalysis analyze(FrameImage frame, int detectorCount) {
        AnalysisMode mode = selectMode(frame, detectorCount);

        if (mode == AnalysisMode.TRACKING) {
            return new CrowdAnalysis(detectorCount, DensityLevel.fromCount(detectorCount),
                    emptyGrid(), PASSTHROUGH_CONFIDENCE, false);
        }

        if (frame == null) {
            log.debug("人群模式但无帧像素，使用检测人数: {}", detectorCount);
            return new CrowdAnalysis(detectorCount, DensityLevel.fromCount(detectorCount),
                    emptyGrid(), MIN_CONFIDENCE, true);
        }

        log.debug("👥 进入人群模式分析，检测人数: {}", detectorCount);

        double edge = edgeDensity(frame);
        double texture = textureDensity(frame);
        double motion = motionDensity(frame);
        double foreground = foregroundRatio(frame);

        float[][] densityMap = densityMap(frame);

        double combined = edge * WEIGHT_EDGE
                + texture * WEIGHT_TEXTURE
                + motion * WEIGHT_MOTION
                + foreground * WEIGHT_FOREGROUND;

        int estimated = estimateCount(combined, frame.getArea());
        // 不低于检测器给出的人数
        int finalCount = Math.max(estimated, detectorCount);
        double confidence = confidence(edge, texture, motion, foreground);

        return new CrowdAnalysis(finalCount, DensityLevel.fromCount(finalCount), densityMap, confidence, true);
    }

    /**
     * 模式判断，检测数条件优先，避免无谓的像素采样
     */
    public AnalysisMode selectMode(FrameImage frame, int detectorCount) {
        if (detectorCount > crowdModeThreshold) return AnalysisMode.CROWD;
        double quick = frame == null ? 0.0 : quickDensity(frame);
        return AnalysisMode.select(detectorCount, crowdModeThreshold, quick, highDensityThreshold);
    }

    /**
     * 粗步长采样，与左侧、上方采样点颜色差过大的点记为边缘
     */
    double quickDensity(FrameImage frame) {
        int edgePixels = 0;
        int totalSampled = 0;

        for (int y = 0; y < frame.getHeight(); y += QUICK_SAMPLE_RATE) {
            for (int x = 0; x < frame.getWidth(); x += QUICK_SAMPLE_RATE) {
                if (x > 0 && y > 0) {
                    int pixel = frame.getPixel(x, y);
                    int diff = FrameImage.colorDifference(pixel, frame.getPixel(x - QUICK_SAMPLE_RATE, y))
                            + FrameImage.colorDifference(pixel, frame.getPixel(x, y - QUICK_SAMPLE_RATE));
                    if (diff > MIN_EDGE_THRESHOLD * 2) {
                        edgePixels++;
                    }
                }
                totalSampled++;
            }
        }

        return totalSampled == 0 ? 0.0 : (double) edgePixels / totalSampled;
    }

    /**
     * Sobel梯度幅值超过阈值的像素比例
     */
    double edgeDensity(FrameImage frame) {
        int width = frame.getWidth();
        int height = frame.getHeight();
        int edgeCount = 0;

        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                int tl = frame.getGray(x - 1, y - 1);
                int tc = frame.getGray(x, y - 1);
                int tr = frame.getGray(x + 1, y - 1);
                int ml = frame.getGray(x - 1, y);
                int mr = frame.getGray(x + 1, y);
                int bl = frame.getGray(x - 1, y + 1);
                int bc = frame.getGray(x, y + 1);
                int br = frame.getGray(x + 1, y + 1);

                double gx = (tr + 2 * mr + br) - (tl + 2 * ml + bl);
                double gy = (bl + 2 * bc + br) - (tl + 2 * tc + tr);

                if (Math.sqrt(gx * gx + gy * gy) > MIN_EDGE_THRESHOLD) {
                    edgeCount++;
                }
            }
        }

        return (double) edgeCount / frame.getArea() * 10;
    }

    /**
     * 16x16窗口灰度标准差的平均值
     */
    double textureDensity(FrameImage frame) {
        double total = 0;
        int windows = 0;

        for (int y = 0; y < frame.getHeight() - TEXTURE_WINDOW_SIZE; y += TEXTURE_WINDOW_SIZE) {
            for (int x = 0; x < frame.getWidth() - TEXTURE_WINDOW_SIZE; x += TEXTURE_WINDOW_SIZE) {
                total += windowComplexity(frame, x, y);
                windows++;
            }
        }

        return windows > 0 ? total / windows * 2 : 0.0;
    }

    private double windowComplexity(FrameImage frame, int startX, int startY) {
        int endX = Math.min(startX + TEXTURE_WINDOW_SIZE, frame.getWidth());
        int endY = Math.min(startY + TEXTURE_WINDOW_SIZE, frame.getHeight());
        int n = (endX - startX) * (endY - startY);
        if (n <= 0) return 0.0;

        double sum = 0;
        for (int y = startY; y < endY; y++) {
            for (int x = startX; x < endX; x++) {
                sum += frame.getGray(x, y);
            }
        }
        double mean = sum / n;

        double variance = 0;
        for (int y = startY; y < endY; y++) {
            for (int x = startX; x < endX; x++) {
                double d = frame.getGray(x, y) - mean;
                variance += d * d;
            }
        }
        variance /= n;

        return Math.sqrt(variance) / 128.0;
    }

    /**
     * 与上一帧的采样差分比例，取最近10帧平均；没有可比的上一帧时返回0.5
     */
    double motionDensity(FrameImage frame) {
        FrameImage previous = previousFrame;
        previousFrame = frame;
        if (!frame.sameSizeAs(previous)) {
            return 0.5;
        }

        int motionPixels = 0;
        int totalSampled = 0;
        for (int y = 0; y < frame.getHeight(); y += SAMPLE_RATE) {
            for (int x = 0; x < frame.getWidth(); x += SAMPLE_RATE) {
                if (FrameImage.colorDifference(frame.getPixel(x, y), previous.getPixel(x, y)) > MOTION_THRESHOLD) {
                    motionPixels++;
                }
                totalSampled++;
            }
        }

        motionHistory.add((double) motionPixels / totalSampled);

        double sum = 0;
        for (int i = 0; i < motionHistory.size(); i++) {
            sum += motionHistory.get(i);
        }
        return sum / motionHistory.size() * 5;
    }

    /**
     * 与众数灰度相差超过30的采样点比例（简易背景减除）
     */
    double foregroundRatio(FrameImage frame) {
        int[] histogram = new int[256];
        for (int y = 0; y < frame.getHeight(); y += SAMPLE_RATE) {
            for (int x = 0; x < frame.getWidth(); x += SAMPLE_RATE) {
                histogram[frame.getGray(x, y)]++;
            }
        }

        int background = 0;
        for (int i = 1; i < histogram.length; i++) {
            if (histogram[i] > histogram[background]) {
                background = i;
            }
        }

        int foreground = 0;
        int total = 0;
        for (int y = 0; y < frame.getHeight(); y += SAMPLE_RATE) {
            for (int x = 0; x < frame.getWidth(); x += SAMPLE_RATE) {
                if (Math.abs(frame.getGray(x, y) - background) > FOREGROUND_THRESHOLD) {
                    foreground++;
                }
                total++;
            }
        }

        return (double) foreground / total * 3;
    }

    /**
     * 固定网格热力图，每格为暗像素（灰度&lt;100）比例
     */
    float[][] densityMap(FrameImage frame) {
        float[][] map = emptyGrid();
        int cellWidth = frame.getWidth() / GRID_SIZE;
        int cellHeight = frame.getHeight() / GRID_SIZE;
        if (cellWidth == 0 || cellHeight == 0) {
            return map;
        }

        for (int gridY = 0; gridY < GRID_SIZE; gridY++) {
            for (int gridX = 0; gridX < GRID_SIZE; gridX++) {
                int startX = gridX * cellWidth;
                int startY = gridY * cellHeight;
                int dark = 0;
                for (int y = startY; y < startY + cellHeight; y++) {
                    for (int x = startX; x < startX + cellWidth; x++) {
                        if (frame.getGray(x, y) < DARK_PIXEL_THRESHOLD) {
                            dark++;
                        }
                    }
                }
                map[gridY][gridX] = (float) dark / (cellWidth * cellHeight);
            }
        }
        return map;
    }

    /**
     * 密度换算人数，至少为1
     */
    static int estimateCount(double density, int frameArea) {
        double pixelsPerPerson;
        if (density < 0.3) {
            pixelsPerPerson = PIXELS_PER_PERSON_SPARSE;
        } else if (density < 0.6) {
            pixelsPerPerson = PIXELS_PER_PERSON_DENSE;
        } else {
            pixelsPerPerson = PIXELS_PER_PERSON_PACKED;
        }

        int baseCount = (int) (frameArea * density / pixelsPerPerson);
        int corrected = (int) (baseCount * correctionFactor(density));
        return Math.max(1, corrected);
    }

    /**
     * 按密度修正，高密度时补偿遮挡
     */
    static double correctionFactor(double density) {
        if (density < 0.2) return 1.2;
        if (density < 0.5) return 1.0;
        if (density < 0.7) return 0.9;
        return 0.85;
    }

    /**
     * 四种信号越一致置信度越高，限制在 [0.3, 0.9]
     */
    static double confidence(double... signals) {
        double mean = 0;
        for (double s : signals) {
            mean += s;
        }
        mean /= signals.length;
        if (mean <= 0) return MIN_CONFIDENCE;

        double variance = 0;
        for (double s : signals) {
            variance += (s - mean) * (s - mean);
        }
        double stdDev = Math.sqrt(variance / signals.length);

        double confidence = 1.0 - Math.min(stdDev / mean, 1.0);
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
    }

    private static float[][] emptyGrid() {
        return new float[GRID_SIZE][GRID_SIZE];
    }

    /**
     * 清除上一帧与运动历史
     */
    public void reset() {
        previousFrame = null;
        motionHistory.clear();
    }

    public int getCrowdModeThreshold() {
        return crowdModeThreshold;
    }

    public double getHighDensityThreshold() {
        return highDensityThreshold;
    }
}
