package com.calai.portion.nutrition;

import com.calai.portion.volume.exception.InvalidEstimationInputException;
import org.springframework.stereotype.Component;

/**
 * 每 100g 營養素 × (估算重量 / 100)。
 * - calories、sodium：取整數
 * - 其餘：小數一位
 */
@Component
public class PortionNutritionCalculator {

    public NutritionInfo forPortion(NutritionInfo per100g, double estimatedWeight) {
        if (per100g == null) throw new InvalidEstimationInputException("NUTRITION_PER_100G_REQUIRED");
        if (!Double.isFinite(estimatedWeight) || estimatedWeight < 0) {
            throw new InvalidEstimationInputException("PORTION_WEIGHT_INVALID", String.valueOf(estimatedWeight));
        }

        double m = estimatedWeight / 100.0;

        return new NutritionInfo(
                Math.round(per100g.calories() * m),
                oneDecimal(per100g.protein() * m),
                oneDecimal(per100g.carbs() * m),
                oneDecimal(per100g.fat() * m),
                oneDecimal(per100g.fiber() * m),
                oneDecimal(per100g.sugar() * m),
                Math.round(per100g.sodium() * m),
                scaleOptional(per100g.saturatedFat(), m),
                scaleOptional(per100g.transFat(), m),
                scaleOptional(per100g.cholesterol(), m),
                scaleOptional(per100g.potassium(), m),
                scaleOptional(per100g.calcium(), m),
                scaleOptional(per100g.iron(), m),
                scaleOptional(per100g.vitaminA(), m),
                scaleOptional(per100g.vitaminC(), m),
                scaleOptional(per100g.vitaminD(), m)
        );
    }

    private static Double scaleOptional(Double v, double m) {
        return (v == null) ? null : oneDecimal(v * m);
    }

    private static double oneDecimal(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
