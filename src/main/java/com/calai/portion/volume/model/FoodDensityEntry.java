package com.calai.portion.volume.model;

/**
 * 密度表的一筆資料（immutable，更新時整筆替換）
 *
 * @param density         g/ml
 * @param densityVariance 密度變異
 * @param shapePrior      食物典型外形
 * @param compressibility 0..1，食物受壓後的體積變化程度
 */
public record FoodDensityEntry(
        double density,
        double densityVariance,
        FoodShape shapePrior,
        double compressibility
) {

    /** 未知食物一律用這組（水的密度） */
    public static final FoodDensityEntry DEFAULT =
            new FoodDensityEntry(1.0, 0.0, FoodShape.IRREGULAR, 0.5);

    public FoodDensityEntry {
        if (!Double.isFinite(density) || density <= 0) {
            throw new IllegalArgumentException("DENSITY_INVALID");
        }
        if (!Double.isFinite(densityVariance) || densityVariance < 0) {
            throw new IllegalArgumentException("DENSITY_VARIANCE_INVALID");
        }
        if (!Double.isFinite(compressibility) || compressibility < 0 || compressibility > 1) {
            throw new IllegalArgumentException("COMPRESSIBILITY_INVALID");
        }
        if (shapePrior == null) shapePrior = FoodShape.IRREGULAR;
    }

    public FoodDensityEntry withDensity(double newDensity) {
        return new FoodDensityEntry(newDensity, densityVariance, shapePrior, compressibility);
    }
}
