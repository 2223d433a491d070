package com.calai.portion.volume.density;

import java.text.Normalizer;
import java.util.Locale;

/**
 * 密度表的 key 正規化：
 * 1) NFKC（全形 -> 半形）
 * 2) 底線 / 連字號視為空白
 * 3) toLowerCase + 壓縮空白
 * "  Grilled_Chicken  Breast" -> "grilled chicken breast"
 */
public final class FoodNameNormalizer {
    private FoodNameNormalizer() {}

    public static String normalize(String s) {
        if (s == null || s.isEmpty()) return "";
        String t = Normalizer.normalize(s, Normalizer.Form.NFKC);
        t = t.replace('_', ' ').replace('-', ' ');
        return t.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }
}
