package com.calai.portion.volume.service;

import com.calai.portion.volume.config.VolumeEstimationProperties;
import com.calai.portion.volume.density.FoodDensityRepository;
import com.calai.portion.volume.depth.DepthEstimator;
import com.calai.portion.volume.exception.InvalidEstimationInputException;
import com.calai.portion.volume.geometry.VolumeCalculator;
import com.calai.portion.volume.model.BoundingBox;
import com.calai.portion.volume.model.DepthEstimate;
import com.calai.portion.volume.model.Dimensions;
import com.calai.portion.volume.model.FoodCategory;
import com.calai.portion.volume.model.FoodClassification;
import com.calai.portion.volume.model.FoodDensityEntry;
import com.calai.portion.volume.model.ImageSource;
import com.calai.portion.volume.model.ReferenceObject;
import com.calai.portion.volume.model.ShapeAnalysis;
import com.calai.portion.volume.model.VolumeEstimationResult;
import com.calai.portion.volume.reference.ReferenceObjectDetector;
import com.calai.portion.volume.shape.ShapeAnalyzer;
import com.calai.portion.volume.telemetry.EstimationTelemetry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 份量估算主流程（每次呼叫一次決策，產出結果即結束）：
 * <ol>
 *   <li>reference_object：有可用參考物 -> 用比例尺換算實際尺寸（confidence = 0.9 × 偵測分數）</li>
 *   <li>3d_analysis：有深度 -> 深度當高度（confidence 固定 0.85）</li>
 *   <li>ml_estimation：永遠可用的 fallback（confidence 固定 0.6）</li>
 * </ol>
 * 證據缺失不是錯誤，只反映在 method / confidence；只有輸入違規會丟例外。
 */
@Slf4j
@Service
public class VolumeEstimationService {

    static final double REFERENCE_CONFIDENCE_FACTOR = 0.9;
    static final double DEPTH_CONFIDENCE = 0.85;
    static final double HEURISTIC_CONFIDENCE = 0.6;

    /** 參考物路徑看不到深度：取較短邊 × 0.8 */
    static final double REFERENCE_DEPTH_RATIO = 0.8;
    /** 深度路徑沒有比例尺：pixel -> cm 固定係數 */
    static final double DEPTH_PIXEL_TO_CM = 0.1;
    /** fallback：√(pixel 面積) × 形狀係數 × 10 -> ml（無單位校正） */
    static final double HEURISTIC_VOLUME_SCALE = 10.0;

    private final ReferenceObjectDetector referenceDetector;
    private final DepthEstimator depthEstimator;
    private final ShapeAnalyzer shapeAnalyzer;
    private final VolumeCalculator volumeCalculator;
    private final FoodDensityRepository densityRepository;
    private final Executor evidenceExecutor;
    private final Duration evidenceTimeout;
    private final EstimationTelemetry telemetry;

    public VolumeEstimationService(
            ReferenceObjectDetector referenceDetector,
            DepthEstimator depthEstimator,
            ShapeAnalyzer shapeAnalyzer,
            VolumeCalculator volumeCalculator,
            FoodDensityRepository densityRepository,
            @Qualifier("volumeEvidenceExecutor") Executor evidenceExecutor,
            VolumeEstimationProperties props,
            EstimationTelemetry telemetry
    ) {
        this.referenceDetector = referenceDetector;
        this.depthEstimator = depthEstimator;
        this.shapeAnalyzer = shapeAnalyzer;
        this.volumeCalculator = volumeCalculator;
        this.densityRepository = densityRepository;
        this.evidenceExecutor = evidenceExecutor;
        this.evidenceTimeout = props.getEvidenceTimeout();
        this.telemetry = telemetry;
    }

    public VolumeEstimationResult estimate(ImageSource image, FoodClassification food, BoundingBox box) {
        if (food == null) throw new InvalidEstimationInputException("FOOD_NAME_REQUIRED");
        return estimate(image, food.name(), food.category(), box);
    }

    public VolumeEstimationResult estimate(ImageSource image, String foodName, FoodCategory category, BoundingBox box) {
        if (image == null) throw new InvalidEstimationInputException("IMAGE_REQUIRED");
        if (foodName == null || foodName.isBlank()) throw new InvalidEstimationInputException("FOOD_NAME_REQUIRED");
        if (box == null) throw new InvalidEstimationInputException("BOUNDING_BOX_REQUIRED");
        FoodCategory cat = (category == null) ? FoodCategory.OTHER : category;

        long t0 = System.nanoTime();

        // ===== 1) 兩個證據來源互不相依，並行跑 =====
        CompletableFuture<List<ReferenceObject>> refF = submit(() -> referenceDetector.detect(image));
        CompletableFuture<DepthEstimate> depthF = submit(() -> depthEstimator.estimate(image, box));

        long deadline = System.nanoTime() + evidenceTimeout.toNanos();
        List<ReferenceObject> refs = await(refF, List.of(), deadline, "REFERENCE", image);
        DepthEstimate depth = await(depthF, DepthEstimate.none(), deadline, "DEPTH", image);
        if (refs == null) refs = List.of();
        if (depth == null) depth = DepthEstimate.none();

        // ===== 2) 外形（未知食物 density 是 DEFAULT，prior 靠名稱） =====
        FoodDensityEntry density = densityRepository.lookup(foodName);
        ShapeAnalysis shape = shapeAnalyzer.analyze(box, ShapeAnalyzer.priorFor(foodName, density.shapePrior()));

        // ===== 3) 依優先順序挑證據 =====
        Optional<ReferenceObject> ref = refs.stream()
                .filter(r -> r != null && r.usable())
                .max(Comparator.comparingDouble(ReferenceObject::confidence));

        VolumeEstimationResult result;
        if (ref.isPresent()) {
            result = withReference(foodName, box, shape, density, ref.get());
        } else if (depth.hasDepthData()) {
            result = withDepth(foodName, box, shape, density, depth);
        } else {
            result = withHeuristic(foodName, box, shape, density);
        }

        telemetry.estimated(result, cat, image.imageId(), refs.size(), depth.hasDepthData(),
                (System.nanoTime() - t0) / 1_000_000);
        return result;
    }

    VolumeEstimationResult withReference(String foodName, BoundingBox box, ShapeAnalysis shape,
                                         FoodDensityEntry density, ReferenceObject ref) {
        double scale = ref.averageScale();
        double realW = box.width() * scale;
        double realH = box.height() * scale;
        double realDepth = Math.min(realW, realH) * REFERENCE_DEPTH_RATIO;

        Dimensions dims = new Dimensions(realW, realH, realDepth);
        double volume = volumeCalculator.volume(shape.shape(), dims);

        return new VolumeEstimationResult.ReferenceObjectEstimate(
                foodName,
                roundNonNegative(volume),
                roundNonNegative(volume * density.density()),
                clamp01(ref.confidence() * REFERENCE_CONFIDENCE_FACTOR),
                box,
                shapeAnalyzer.rescale(shape, dims),
                density,
                ref
        );
    }

    VolumeEstimationResult withDepth(String foodName, BoundingBox box, ShapeAnalysis shape,
                                     FoodDensityEntry density, DepthEstimate depth) {
        double realW = box.width() * DEPTH_PIXEL_TO_CM;
        double realH = box.height() * DEPTH_PIXEL_TO_CM;
        double realDepth = depth.averageDepth();

        Dimensions dims = new Dimensions(realW, realH, realDepth);
        double volume = volumeCalculator.volume(shape.shape(), dims, realDepth);

        return new VolumeEstimationResult.DepthAnalysisEstimate(
                foodName,
                roundNonNegative(volume),
                roundNonNegative(volume * density.density()),
                DEPTH_CONFIDENCE,
                box,
                shapeAnalyzer.rescale(shape, dims),
                density,
                depth
        );
    }

    VolumeEstimationResult withHeuristic(String foodName, BoundingBox box, ShapeAnalysis shape,
                                         FoodDensityEntry density) {
        double volume = heuristicVolume(box, shape);

        return new VolumeEstimationResult.HeuristicEstimate(
                foodName,
                roundNonNegative(volume),
                roundNonNegative(volume * density.density()),
                HEURISTIC_CONFIDENCE,
                box,
                shape,
                density
        );
    }

    static double heuristicVolume(BoundingBox box, ShapeAnalysis shape) {
        return Math.sqrt(box.area()) * shape.shape().heuristicMultiplier() * HEURISTIC_VOLUME_SCALE;
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, evidenceExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> T await(CompletableFuture<T> f, T fallback, long deadlineNanos, String source, ImageSource image) {
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            return f.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            telemetry.evidenceFailed(source, image.imageId(), "TIMEOUT");
            return fallback;
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() == null) ? e : e.getCause();
            String reason = (cause instanceof RejectedExecutionException) ? "REJECTED" : cause.toString();
            telemetry.evidenceFailed(source, image.imageId(), reason);
            return fallback;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            telemetry.evidenceFailed(source, image.imageId(), "INTERRUPTED");
            return fallback;
        }
    }

    private static long roundNonNegative(double v) {
        if (!Double.isFinite(v) || v <= 0) return 0L;
        return Math.round(v);
    }

    private static double clamp01(double v) {
        if (!Double.isFinite(v) || v < 0) return 0.0;
        return Math.min(v, 1.0);
    }
}
