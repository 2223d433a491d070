package com.calai.portion.volume.depth;

import com.calai.portion.volume.model.ImageSource;

/**
 * 深度推論（黑盒）：輸入整張影像，輸出深度圖。
 */
public interface DepthModel {

    /** 例如 NONE / STUB / MIDAS */
    String backendCode();

    DepthMap infer(ImageSource image) throws Exception;
}
