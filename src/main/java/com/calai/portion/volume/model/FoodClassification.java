package com.calai.portion.volume.model;

/**
 * 上游食物辨識的結果，進入本引擎前已經決定好。
 */
public record FoodClassification(String name, FoodCategory category, double confidence) {
}
