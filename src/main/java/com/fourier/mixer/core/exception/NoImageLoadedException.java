package com.fourier.mixer.core.exception;

/**
 * 在上传图像之前请求了图像分量
 */
public class NoImageLoadedException extends MixerException {

    public NoImageLoadedException() {
        super("No image data loaded");
    }
}
