package com.calai.portion.volume.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 單次估算結果（immutable，回傳後所有權交給呼叫端）。
 * <p>
 * 每種 method 一個 record，只帶該 method 有意義的欄位：
 * <ul>
 *   <li>{@link ReferenceObjectEstimate}：用到的參考物</li>
 *   <li>{@link DepthAnalysisEstimate}：深度估計</li>
 *   <li>{@link HeuristicEstimate}：無額外證據</li>
 * </ul>
 * volume / weight 已在邊界四捨五入成整數（ml / g）。
 */
public interface VolumeEstimationResult {

    String foodName();

    long estimatedVolume();

    long estimatedWeight();

    double confidence();

    BoundingBox boundingBox();

    ShapeAnalysis shapeAnalysis();

    FoodDensityEntry densityEntry();

    @JsonProperty("method")
    EstimationMethod method();

    record ReferenceObjectEstimate(
            String foodName,
            long estimatedVolume,
            long estimatedWeight,
            double confidence,
            BoundingBox boundingBox,
            ShapeAnalysis shapeAnalysis,
            FoodDensityEntry densityEntry,
            ReferenceObject referenceObject
    ) implements VolumeEstimationResult {
        @Override
        public EstimationMethod method() {
            return EstimationMethod.REFERENCE_OBJECT;
        }
    }

    record DepthAnalysisEstimate(
            String foodName,
            long estimatedVolume,
            long estimatedWeight,
            double confidence,
            BoundingBox boundingBox,
            ShapeAnalysis shapeAnalysis,
            FoodDensityEntry densityEntry,
            DepthEstimate depthEstimation
    ) implements VolumeEstimationResult {
        @Override
        public EstimationMethod method() {
            return EstimationMethod.DEPTH_ANALYSIS;
        }
    }

    record HeuristicEstimate(
            String foodName,
            long estimatedVolume,
            long estimatedWeight,
            double confidence,
            BoundingBox boundingBox,
            ShapeAnalysis shapeAnalysis,
            FoodDensityEntry densityEntry
    ) implements VolumeEstimationResult {
        @Override
        public EstimationMethod method() {
            return EstimationMethod.ML_ESTIMATION;
        }
    }
}
