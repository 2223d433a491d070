package com.calai.portion.volume.reference;

import com.calai.portion.volume.density.FoodNameNormalizer;
import com.calai.portion.volume.model.ReferenceObject;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 已知實際尺寸的日常物件（cm）。
 * 信用卡是 ISO/IEC 7810 ID-1：8.56 × 5.398。
 */
public enum ReferenceObjectCatalog {
    CREDIT_CARD("Credit Card", 8.56, 5.398, List.of("card", "payment card", "bank card", "id card")),
    COIN("Coin", 2.4, 2.4, List.of()),
    PHONE("Phone", 7.5, 15.0, List.of("smartphone", "cell phone", "mobile phone")),
    FORK("Fork", 2.0, 18.0, List.of()),
    SPOON("Spoon", 3.0, 16.0, List.of("tablespoon")),
    PLATE("Plate", 25.0, 25.0, List.of("dinner plate")),
    CUP("Cup", 8.0, 10.0, List.of("mug"));

    private final String displayName;
    private final double widthCm;
    private final double heightCm;
    private final List<String> aliases;

    private static final Map<String, ReferenceObjectCatalog> BY_LABEL = new HashMap<>();

    static {
        for (ReferenceObjectCatalog c : values()) {
            BY_LABEL.put(FoodNameNormalizer.normalize(c.displayName), c);
            BY_LABEL.put(FoodNameNormalizer.normalize(c.name()), c);
            for (String a : c.aliases) BY_LABEL.put(FoodNameNormalizer.normalize(a), c);
        }
    }

    ReferenceObjectCatalog(String displayName, double widthCm, double heightCm, List<String> aliases) {
        this.displayName = displayName;
        this.widthCm = widthCm;
        this.heightCm = heightCm;
        this.aliases = aliases;
    }

    public String displayName() { return displayName; }
    public double widthCm() { return widthCm; }
    public double heightCm() { return heightCm; }

    public ReferenceObject.RealWorldSize realWorldSize() {
        return new ReferenceObject.RealWorldSize(widthCm, heightCm);
    }

    /** label 大小寫、底線、連字號都容忍："credit_card" / "Credit-Card" */
    public static Optional<ReferenceObjectCatalog> byLabel(String label) {
        String key = FoodNameNormalizer.normalize(label);
        if (key.isEmpty()) return Optional.empty();
        return Optional.ofNullable(BY_LABEL.get(key));
    }
}
