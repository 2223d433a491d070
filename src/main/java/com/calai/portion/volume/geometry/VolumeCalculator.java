package com.calai.portion.volume.geometry;

import com.calai.portion.volume.model.Dimensions;
import com.calai.portion.volume.model.FoodShape;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * 形狀 -> 體積公式（純函數，無隨機性）。
 * 輸入單位是 cm，輸出 cm³，數值上等於 ml。
 */
@Component
public class VolumeCalculator {

    private static final double FOUR_THIRDS_PI = 4.0 / 3.0 * Math.PI;

    private final Map<FoodShape, VolumeFormula> formulas;

    public VolumeCalculator() {
        this(defaultFormulas());
    }

    VolumeCalculator(Map<FoodShape, VolumeFormula> formulas) {
        EnumMap<FoodShape, VolumeFormula> m = new EnumMap<>(FoodShape.class);
        m.putAll(formulas);
        // ✅ 每個 shape 都要有公式，新增 shape 忘了補會在啟動時就炸
        for (FoodShape s : FoodShape.values()) {
            if (!m.containsKey(s)) throw new IllegalStateException("VOLUME_FORMULA_MISSING: " + s);
        }
        this.formulas = m;
    }

    public double volume(FoodShape shape, Dimensions dims) {
        return volume(shape, dims, null);
    }

    public double volume(FoodShape shape, Dimensions dims, Double measuredDepth) {
        if (shape == null || dims == null) throw new IllegalArgumentException("VOLUME_INPUT_REQUIRED");
        double v = formulas.get(shape).volume(dims, usableDepth(measuredDepth));
        return (Double.isFinite(v) && v > 0) ? v : 0.0;
    }

    static Map<FoodShape, VolumeFormula> defaultFormulas() {
        EnumMap<FoodShape, VolumeFormula> m = new EnumMap<>(FoodShape.class);

        m.put(FoodShape.SPHERICAL, (d, depth) -> {
            double diameter = d.minSide();
            if (depth != null) diameter = Math.min(diameter, depth);
            return spherical(diameter / 2.0);
        });

        m.put(FoodShape.CYLINDRICAL, (d, depth) -> {
            double h = (depth != null) ? depth : d.maxSide();
            return cylindrical(d.minSide() / 2.0, h);
        });

        m.put(FoodShape.RECTANGULAR, (d, depth) ->
                rectangular(d.length(), d.width(), d.height()));

        m.put(FoodShape.IRREGULAR, (d, depth) ->
                ellipsoid(d.length(), d.width(), d.height()));

        return m;
    }

    public static double spherical(double radius) {
        return FOUR_THIRDS_PI * radius * radius * radius;
    }

    public static double cylindrical(double radius, double height) {
        return Math.PI * radius * radius * height;
    }

    public static double rectangular(double length, double width, double height) {
        return length * width * height;
    }

    /** 不規則形狀：以三軸為直徑的橢球近似 */
    public static double ellipsoid(double length, double width, double height) {
        return FOUR_THIRDS_PI * (length / 2.0) * (width / 2.0) * (height / 2.0);
    }

    private static Double usableDepth(Double depth) {
        return (depth != null && Double.isFinite(depth) && depth > 0) ? depth : null;
    }
}
