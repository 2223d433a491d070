package com.calai.portion.volume.shape;

import com.calai.portion.volume.density.FoodNameNormalizer;
import com.calai.portion.volume.model.BoundingBox;
import com.calai.portion.volume.model.Dimensions;
import com.calai.portion.volume.model.FoodShape;
import com.calai.portion.volume.model.ShapeAnalysis;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 由 bounding box 長寬比 + 食物的 shape prior 判斷外形，並給出粗估尺寸。
 * <p>
 * 尺寸是「影像相對」單位（pixel × 固定係數），真正的比例尺由 orchestrator 依證據來源決定，
 * 再透過 {@link #rescale(ShapeAnalysis, Dimensions)} 換成實際尺寸。
 */
@Component
public class ShapeAnalyzer {

    static final double SPHERE_RATIO_MIN = 0.8;
    static final double SPHERE_RATIO_MAX = 1.2;
    static final double ELONGATED_RATIO_HIGH = 2.0;
    static final double ELONGATED_RATIO_LOW = 0.5;

    /** pixel -> cm 粗估 */
    static final double PIXEL_TO_LENGTH = 0.1;
    /** 看不到的深度：平均邊長 × 0.08 */
    static final double DEPTH_FROM_AVERAGE_SIDE = 0.08;

    /** 名稱帶這些字的食物通常是切片 / 塊狀 */
    static final List<String> RECTANGULAR_KEYWORDS = List.of("bread", "cheese");

    /**
     * 中間長寬比時用的 prior：名稱關鍵字（sliced bread、cheddar cheese）優先，其次才是密度表的 prior。
     * 密度表查不到的食物也能靠名稱拿到 rectangular。
     */
    public static FoodShape priorFor(String foodName, FoodShape tablePrior) {
        String n = FoodNameNormalizer.normalize(foodName);
        for (String k : RECTANGULAR_KEYWORDS) {
            if (n.contains(k)) return FoodShape.RECTANGULAR;
        }
        return tablePrior;
    }

    public ShapeAnalysis analyze(BoundingBox box, FoodShape shapePrior) {
        if (box == null) throw new IllegalArgumentException("BOUNDING_BOX_REQUIRED");

        FoodShape shape = classify(box.aspectRatio(), shapePrior);

        Dimensions dims = new Dimensions(
                box.width() * PIXEL_TO_LENGTH,
                box.height() * PIXEL_TO_LENGTH,
                box.averageSide() * DEPTH_FROM_AVERAGE_SIDE
        );

        double surface = (shape == FoodShape.SPHERICAL)
                ? sphereSurface(box.averageSide() * PIXEL_TO_LENGTH / 2.0)
                : surfaceArea(shape, dims);

        return new ShapeAnalysis(shape, dims, surface);
    }

    /**
     * 換成 orchestrator 選定的實際尺寸，shape 不變，表面積重算。
     */
    public ShapeAnalysis rescale(ShapeAnalysis analysis, Dimensions realDims) {
        if (analysis == null || realDims == null) throw new IllegalArgumentException("SHAPE_RESCALE_INPUT_REQUIRED");
        FoodShape shape = analysis.shape();
        double surface = (shape == FoodShape.SPHERICAL)
                ? sphereSurface(realDims.minSide() / 2.0)
                : surfaceArea(shape, realDims);
        return new ShapeAnalysis(shape, realDims, surface);
    }

    static FoodShape classify(double ratio, FoodShape shapePrior) {
        if (ratio >= SPHERE_RATIO_MIN && ratio <= SPHERE_RATIO_MAX) {
            return FoodShape.SPHERICAL; // 接近正方形
        }
        if (ratio > ELONGATED_RATIO_HIGH || ratio < ELONGATED_RATIO_LOW) {
            return FoodShape.CYLINDRICAL; // 很細長
        }
        // 中間地帶交給食物本身的 prior（麵包、起司 -> rectangular）
        return (shapePrior != null) ? shapePrior : FoodShape.IRREGULAR;
    }

    static double surfaceArea(FoodShape shape, Dimensions d) {
        return switch (shape) {
            case SPHERICAL -> sphereSurface(d.minSide() / 2.0);
            case CYLINDRICAL -> {
                double r = d.minSide() / 2.0;
                double h = d.maxSide();
                yield 2 * Math.PI * r * (r + h);
            }
            case RECTANGULAR -> 2 * (d.length() * d.width()
                                     + d.width() * d.height()
                                     + d.height() * d.length());
            // 不規則形狀只能粗估
            case IRREGULAR -> d.length() * d.width() * 1.5;
        };
    }

    private static double sphereSurface(double r) {
        return 4 * Math.PI * r * r;
    }
}
