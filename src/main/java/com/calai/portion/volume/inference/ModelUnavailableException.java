package com.calai.portion.volume.inference;

/**
 * 模型載入失敗 / 尚未設定。只在引擎內部流動，對呼叫端等同「沒有這個證據」。
 */
public class ModelUnavailableException extends Exception {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
