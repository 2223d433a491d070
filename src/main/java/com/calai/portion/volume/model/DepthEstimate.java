package com.calai.portion.volume.model;

/**
 * hasDepthData=false 時 averageDepth / depthVariance 沒有意義（固定 0）
 */
public record DepthEstimate(boolean hasDepthData, double averageDepth, double depthVariance) {

    private static final DepthEstimate NONE = new DepthEstimate(false, 0.0, 0.0);

    public static DepthEstimate none() {
        return NONE;
    }

    public static DepthEstimate of(double averageDepth, double depthVariance) {
        return new DepthEstimate(true, averageDepth, depthVariance);
    }
}
