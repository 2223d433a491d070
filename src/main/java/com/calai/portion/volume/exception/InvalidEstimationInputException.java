package com.calai.portion.volume.exception;

/**
 * 呼叫端違反輸入契約（bounding box 非法、食物名稱缺失...）
 * message 即 errorCode，與其他 IllegalArgumentException 的用法一致。
 */
public class InvalidEstimationInputException extends IllegalArgumentException {

    private final String errorCode;

    public InvalidEstimationInputException(String errorCode) {
        super(errorCode);
        this.errorCode = errorCode;
    }

    public InvalidEstimationInputException(String errorCode, String detail) {
        super(errorCode + ": " + detail);
        this.errorCode = errorCode;
    }

    public String errorCode() { return errorCode; }
}
