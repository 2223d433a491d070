package com.calai.portion.nutrition;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 營養素（每 100g 或每份）。calories kcal、sodium/cholesterol/potassium/calcium/iron mg，其餘 g。
 * 選填欄位為 null 表示來源沒有資料。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NutritionInfo(
        double calories,
        double protein,
        double carbs,
        double fat,
        double fiber,
        double sugar,
        double sodium,
        Double saturatedFat,
        Double transFat,
        Double cholesterol,
        Double potassium,
        Double calcium,
        Double iron,
        Double vitaminA,
        Double vitaminC,
        Double vitaminD
) {

    public static NutritionInfo basic(double calories, double protein, double carbs, double fat,
                                      double fiber, double sugar, double sodium) {
        return new NutritionInfo(calories, protein, carbs, fat, fiber, sugar, sodium,
                null, null, null, null, null, null, null, null, null);
    }
}
