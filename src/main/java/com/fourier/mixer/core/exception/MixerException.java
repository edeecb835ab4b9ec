package com.fourier.mixer.core.exception;

/**
 * 混合器异常基类
 * <p>
 * 核心层只抛出具体子类，由服务层统一转换为错误响应
 */
public class MixerException extends RuntimeException {

    public MixerException(String message) {
        super(message);
    }

    public MixerException(String message, Throwable cause) {
        super(message, cause);
    }
}
