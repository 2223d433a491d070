package com.calai.portion.volume.reference;

import com.calai.portion.volume.model.ImageSource;

import java.util.List;

/**
 * 物件偵測（黑盒）：只負責 label + 像素尺寸 + 分數，實際尺寸由 catalog 決定。
 */
public interface ReferenceDetectionModel {

    String backendCode();

    List<Detection> detect(ImageSource image) throws Exception;

    record Detection(String label, double pixelWidth, double pixelHeight, double score) {}
}
