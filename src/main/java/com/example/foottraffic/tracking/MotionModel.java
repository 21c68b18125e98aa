package com.example.foottraffic.tracking;

/**
 * 单个轨迹的匀速运动模型
 * <p>
 * 状态为中心点、宽高和速度。不传播协方差：校正时位置直接取观测中心，
 * 速度按 {@code v' = 0.5·v + 0.5·(观测中心 − 先验中心)} 指数平滑，尺寸直接替换。
 * 目的是快速响应观测而不是抑制噪声，因此不是卡尔曼滤波。
 */
public class MotionModel {

    static final double VELOCITY_BLEND = 0.5;

    private double cx;
    private double cy;
    private double width;
    private double height;
    private double vx;
    private double vy;

    public MotionModel(BoundingBox initial) {
        initiate(initial);
    }

    /**
     * 以检测框初始化，速度归零
     */
    public void initiate(BoundingBox bbox) {
        cx = bbox.getCenterX();
        cy = bbox.getCenterY();
        width = bbox.getWidth();
        height = bbox.getHeight();
        vx = 0;
        vy = 0;
    }

    /**
     * 按速度推进中心点，尺寸不变
     */
    public BoundingBox predict() {
        cx += vx;
        cy += vy;
        return currentBox();
    }

    /**
     * 用观测框校正状态
     */
    public void correct(BoundingBox measurement) {
        double measuredCx = measurement.getCenterX();
        double measuredCy = measurement.getCenterY();

        vx = VELOCITY_BLEND * vx + (1 - VELOCITY_BLEND) * (measuredCx - cx);
        vy = VELOCITY_BLEND * vy + (1 - VELOCITY_BLEND) * (measuredCy - cy);

        cx = measuredCx;
        cy = measuredCy;
        width = measurement.getWidth();
        height = measurement.getHeight();
    }

    public BoundingBox currentBox() {
        return BoundingBox.fromCenter(cx, cy, width, height);
    }

    public double getVx() {
        return vx;
    }

    public double getVy() {
        return vy;
    }
}
