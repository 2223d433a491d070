package com.calai.portion.volume.depth;

import java.util.Arrays;

/**
 * 深度模型輸出：row-major，單位 cm。
 * values 進出都複製一份，模型之後重用自己的 buffer 不會影響已產生的 map。
 *
 * @param confidence 模型對整張圖的信心 0..1
 */
public record DepthMap(int width, int height, float[] values, double confidence) {

    public DepthMap {
        if (width <= 0 || height <= 0) throw new IllegalArgumentException("DEPTH_MAP_SIZE_INVALID");
        if (values == null || values.length != width * height) {
            throw new IllegalArgumentException("DEPTH_MAP_VALUES_INVALID");
        }
        values = values.clone();
    }

    @Override
    public float[] values() {
        return values.clone();
    }

    public float at(int x, int y) {
        return values[y * width + x];
    }

    public static DepthMap uniform(int width, int height, float depthCm, double confidence) {
        float[] v = new float[width * height];
        Arrays.fill(v, depthCm);
        return new DepthMap(width, height, v, confidence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DepthMap other)) return false;
        return width == other.width && height == other.height
               && Double.compare(confidence, other.confidence) == 0
               && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        int h = 31 * width + height;
        h = 31 * h + Double.hashCode(confidence);
        return 31 * h + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "DepthMap[width=" + width + ", height=" + height + ", confidence=" + confidence + "]";
    }
}
