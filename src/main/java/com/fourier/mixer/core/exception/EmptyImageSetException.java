package com.fourier.mixer.core.exception;

public class EmptyImageSetException extends MixerException {

    public EmptyImageSetException() {
        super("No images provided");
    }
}
