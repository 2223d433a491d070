package com.calai.portion.volume.model;

/**
 * 畫面中偵測到的已知尺寸物件（cm），每次偵測產生，不落地。
 */
public record ReferenceObject(
        String name,
        RealWorldSize realWorldSize,
        PixelSize pixelSize,
        double confidence
) {

    public record RealWorldSize(double width, double height, Double depth) {
        public RealWorldSize(double width, double height) {
            this(width, height, null);
        }
    }

    public record PixelSize(double width, double height) {}

    /** pixel 邊長必須 > 0 才能換算比例尺 */
    public boolean usable() {
        return realWorldSize != null && pixelSize != null
               && pixelSize.width() > 0 && pixelSize.height() > 0
               && realWorldSize.width() > 0 && realWorldSize.height() > 0
               && confidence > 0;
    }

    /** cm / pixel：水平、垂直比例取平均 */
    public double averageScale() {
        double scaleX = realWorldSize.width() / pixelSize.width();
        double scaleY = realWorldSize.height() / pixelSize.height();
        return (scaleX + scaleY) / 2.0;
    }
}
