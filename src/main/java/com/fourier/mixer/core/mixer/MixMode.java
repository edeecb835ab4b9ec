package com.fourier.mixer.core.mixer;

import com.fourier.mixer.core.image.ComponentKind;

import java.util.Locale;

/**
 * 混合模式：每种模式绑定一对参与混合的分量
 */
public enum MixMode {
    /**
     * 幅值 + 相位，掩码只作用于幅值
     */
    MAG_PHASE(ComponentKind.MAGNITUDE, ComponentKind.PHASE),

    /**
     * 实部 + 虚部，掩码同时作用于两部分
     */
    REAL_IMAG(ComponentKind.REAL, ComponentKind.IMAG);

    private final ComponentKind first;
    private final ComponentKind second;

    MixMode(ComponentKind first, ComponentKind second) {
        this.first = first;
        this.second = second;
    }

    public ComponentKind first() {
        return first;
    }

    public ComponentKind second() {
        return second;
    }

    /**
     * 接受 "mag_phase" / "MAG_PHASE" / "real_imag" 等写法
     */
    public static MixMode fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Mix mode is required");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown mode: " + name);
        }
    }
}
