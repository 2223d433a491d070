package com.calai.portion.volume.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FoodShape {
    SPHERICAL(0.5),
    CYLINDRICAL(0.6),
    RECTANGULAR(0.8),
    IRREGULAR(0.4); // 不規則形狀變異最大

    /** 無比例尺 fallback 時，bounding box 面積換體積的形狀係數 */
    private final double heuristicMultiplier;

    FoodShape(double heuristicMultiplier) {
        this.heuristicMultiplier = heuristicMultiplier;
    }

    public double heuristicMultiplier() {
        return heuristicMultiplier;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FoodShape parseOrNull(String s) {
        if (s == null) return null;
        String v = s.trim().toUpperCase(Locale.ROOT);
        if (v.isEmpty()) return null;
        try { return FoodShape.valueOf(v); }
        catch (Exception ignored) { return null; }
    }
}
