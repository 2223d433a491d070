package com.calai.portion.volume.model;

public record Dimensions(double length, double width, double height) {

    public double minSide() {
        return Math.min(length, width);
    }

    public double maxSide() {
        return Math.max(length, width);
    }
}
