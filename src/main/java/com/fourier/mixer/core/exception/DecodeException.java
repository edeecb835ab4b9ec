package com.fourier.mixer.core.exception;

/**
 * 图像解码失败（数据损坏或格式不支持）
 */
public class DecodeException extends MixerException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
