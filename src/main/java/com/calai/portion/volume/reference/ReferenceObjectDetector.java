package com.calai.portion.volume.reference;

import com.calai.portion.volume.model.ImageSource;
import com.calai.portion.volume.model.ReferenceObject;

import java.util.List;

public interface ReferenceObjectDetector {

    /**
     * @return 依 confidence 由高到低排序；找不到回空清單
     */
    List<ReferenceObject> detect(ImageSource image);
}
