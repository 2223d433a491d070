package com.calai.portion.volume.model;

/**
 * 影像 handle：偵測器與深度模型從這裡讀像素，本引擎不規定解碼格式。
 */
public interface ImageSource {

    String imageId();

    int width();

    int height();

    static ImageSource of(String imageId, int width, int height) {
        return new ImageRef(imageId, width, height);
    }

    record ImageRef(String imageId, int width, int height) implements ImageSource {}
}
