package com.fourier.mixer.core.mixer;

import org.opencv.core.Mat;

/**
 * 混合后、重建前的两个分量（已应用掩码）
 */
public class MixedComponents {
    private final MixMode mode;
    private final Mat first;
    private final Mat second;

    public MixedComponents(MixMode mode, Mat first, Mat second) {
        this.mode = mode;
        this.first = first;
        this.second = second;
    }

    public MixMode getMode() { return mode; }
    public Mat getFirst() { return first; }
    public Mat getSecond() { return second; }

    public void release() {
        first.release();
        second.release();
    }
}
