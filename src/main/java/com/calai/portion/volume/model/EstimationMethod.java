package com.calai.portion.volume.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 實際採用的證據來源（不是「嘗試過」的來源）
 */
public enum EstimationMethod {
    REFERENCE_OBJECT("reference_object"),
    DEPTH_ANALYSIS("3d_analysis"),
    ML_ESTIMATION("ml_estimation");

    private final String code;

    EstimationMethod(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
