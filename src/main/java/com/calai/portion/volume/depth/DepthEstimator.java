package com.calai.portion.volume.depth;

import com.calai.portion.volume.model.BoundingBox;
import com.calai.portion.volume.model.DepthEstimate;
import com.calai.portion.volume.model.ImageSource;

public interface DepthEstimator {

    /**
     * 模型不可用或沒有可信訊號時回 {@link DepthEstimate#none()}，這不是錯誤。
     */
    DepthEstimate estimate(ImageSource image, BoundingBox box);
}
