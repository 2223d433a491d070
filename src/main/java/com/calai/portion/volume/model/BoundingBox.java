package com.calai.portion.volume.model;

import com.calai.portion.volume.exception.InvalidEstimationInputException;

/**
 * 影像像素座標的 axis-aligned 矩形。
 * ✅ width/height 必須 > 0，否則直接 fail-fast（不要默默算出 0 體積）
 */
public record BoundingBox(double x, double y, double width, double height) {

    public BoundingBox {
        if (!Double.isFinite(x) || !Double.isFinite(y)
            || !Double.isFinite(width) || !Double.isFinite(height)) {
            throw new InvalidEstimationInputException("BOUNDING_BOX_INVALID", "non-finite coordinate");
        }
        if (width <= 0 || height <= 0) {
            throw new InvalidEstimationInputException("BOUNDING_BOX_INVALID",
                    "width=" + width + ", height=" + height);
        }
    }

    public double area() {
        return width * height;
    }

    public double aspectRatio() {
        return width / height;
    }

    public double averageSide() {
        return (width + height) / 2.0;
    }
}
