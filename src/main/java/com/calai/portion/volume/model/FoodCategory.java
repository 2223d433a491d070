package com.calai.portion.volume.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FoodCategory {
    FRUITS,
    VEGETABLES,
    GRAINS,
    PROTEIN,
    DAIRY,
    FATS_OILS,
    BEVERAGES,
    SNACKS,
    DESSERTS,
    FAST_FOOD,
    PREPARED_MEALS,
    CONDIMENTS,
    OTHER;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 無法辨識 -> OTHER（上游分類結果不可信時也不擋） */
    @JsonCreator
    public static FoodCategory parseOrOther(String s) {
        if (s == null) return OTHER;
        String v = s.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        if (v.isEmpty()) return OTHER;
        try { return FoodCategory.valueOf(v); }
        catch (Exception ignored) { return OTHER; }
    }
}
