package com.calai.portion.volume.model;

public record ShapeAnalysis(FoodShape shape, Dimensions dimensions, double surfaceArea) {
}
