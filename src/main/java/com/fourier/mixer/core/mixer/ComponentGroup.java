package com.fourier.mixer.core.mixer;

import java.util.Locale;

/**
 * 槽位权重归入哪一组分量：FIRST 对应幅值/实部，SECOND 对应相位/虚部
 */
public enum ComponentGroup {
    FIRST,
    SECOND;

    /**
     * 接受 "first"/"1"/"component1"，以及分量名（magnitude/real 归第一组，phase/imag 归第二组）
     */
    public static ComponentGroup fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Component group is required");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "first":
            case "1":
            case "component1":
            case "magnitude":
            case "real":
                return FIRST;
            case "second":
            case "2":
            case "component2":
            case "phase":
            case "imag":
            case "imaginary":
                return SECOND;
            default:
                throw new IllegalArgumentException("Unknown component group: " + name);
        }
    }
}
