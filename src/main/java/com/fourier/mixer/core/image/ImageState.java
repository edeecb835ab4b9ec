package com.fourier.mixer.core.image;

/**
 * ImageStore 的缓存状态
 * <pre>
 * EMPTY --load--> RAW_ONLY --getComponent(频域)--> TRANSFORM_COMPUTED
 * RAW_ONLY / TRANSFORM_COMPUTED --load/resize--> RAW_ONLY
 * </pre>
 */
public enum ImageState {
    EMPTY,
    RAW_ONLY,
    TRANSFORM_COMPUTED
}
