package com.fourier.mixer.core.exception;

import com.fourier.mixer.core.image.ImageShape;

/**
 * 掩码或参与混合的图像尺寸与参考图像不一致
 */
public class ShapeMismatchException extends MixerException {

    private final ImageShape expected;
    private final ImageShape actual;

    public ShapeMismatchException(String what, ImageShape expected, ImageShape actual) {
        super(what + " shape " + actual + " does not match image shape " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public ImageShape getExpected() { return expected; }
    public ImageShape getActual() { return actual; }
}
