package com.calai.portion.volume.geometry;

import com.calai.portion.volume.model.Dimensions;

@FunctionalInterface
public interface VolumeFormula {

    /**
     * @param dims          實際尺寸（cm）
     * @param measuredDepth 量測到的深度（cm），沒有就傳 null
     * @return cm³（= ml）
     */
    double volume(Dimensions dims, Double measuredDepth);
}
