package com.example.foottraffic.analysis;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * 帧像素缓冲区，按行存储的 ARGB 像素
 */
public class FrameImage {

    private final int width;
    private final int height;
    private final int[] pixels;
    private int[] gray;

    public FrameImage(int width, int height, int[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("无效的帧尺寸: " + width + "x" + height);
        }
        if (pixels.length != width * height) {
            throw new IllegalArgumentException("像素数量与尺寸不一致: " + pixels.length + " != " + width * height);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    public static FrameImage fromBufferedImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        return new FrameImage(w, h, image.getRGB(0, 0, w, h, null, 0, w));
    }

    /**
     * 单色帧，主要用于测试和占位
     */
    public static FrameImage filled(int width, int height, int argb) {
        int[] pixels = new int[width * height];
        Arrays.fill(pixels, argb);
        return new FrameImage(width, height, pixels);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getArea() {
        return width * height;
    }

    public int getPixel(int x, int y) {
        return pixels[y * width + x];
    }

    /**
     * 灰度值 0.299R + 0.587G + 0.114B，首次调用时计算并缓存
     */
    public int getGray(int x, int y) {
        if (gray == null) {
            int[] g = new int[pixels.length];
            for (int i = 0; i < pixels.length; i++) {
                g[i] = toGray(pixels[i]);
            }
            gray = g;
        }
        return gray[y * width + x];
    }

    public boolean sameSizeAs(FrameImage other) {
        return other != null && other.width == width && other.height == height;
    }

    static int toGray(int argb) {
        int r = (argb >> 16) & 0xFF;
        int g = (argb >> 8) & 0xFF;
        int b = argb & 0xFF;
        return (int) (0.299 * r + 0.587 * g + 0.114 * b);
    }

    /**
     * 两个像素RGB通道差的绝对值之和
     */
    static int colorDifference(int p1, int p2) {
        return Math.abs(((p1 >> 16) & 0xFF) - ((p2 >> 16) & 0xFF))
                + Math.abs(((p1 >> 8) & 0xFF) - ((p2 >> 8) & 0xFF))
                + Math.abs((p1 & 0xFF) - (p2 & 0xFF));
    }
}
