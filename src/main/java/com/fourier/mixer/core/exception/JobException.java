package com.fourier.mixer.core.exception;

/**
 * 后台混合任务失败
 * <p>
 * 不会同步抛给调用方，只通过进度哨兵值 (-1.0) 和 {@code getLastError()} 暴露
 */
public class JobException extends MixerException {

    public JobException(String message, Throwable cause) {
        super(message, cause);
    }
}
