package com.calai.portion.volume.depth;

import com.calai.portion.volume.model.ImageSource;

/**
 * 本機 / 開發用：整張圖同一個深度，不讀像素。
 */
public class StubDepthModel implements DepthModel {

    private static final int MAP_SIZE = 64;

    private final float depthCm;

    public StubDepthModel(double depthCm) {
        if (!(depthCm > 0)) throw new IllegalArgumentException("STUB_DEPTH_INVALID");
        this.depthCm = (float) depthCm;
    }

    @Override
    public String backendCode() {
        return "STUB";
    }

    @Override
    public DepthMap infer(ImageSource image) {
        return DepthMap.uniform(MAP_SIZE, MAP_SIZE, depthCm, 1.0);
    }
}
