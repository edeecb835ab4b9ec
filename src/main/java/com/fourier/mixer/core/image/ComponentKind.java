package com.fourier.mixer.core.image;

import java.util.Locale;

/**
 * 图像数据的五种表示：原始灰度，以及居中傅里叶变换的幅值、相位、实部、虚部
 */
public enum ComponentKind {
    RAW("raw"),
    MAGNITUDE("magnitude"),
    PHASE("phase"),
    REAL("real"),
    IMAG("imag");

    private final String key;

    ComponentKind(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * 是否需要 log(1+|x|) 压缩后再显示
     */
    public boolean isLogCompressed() {
        return this == MAGNITUDE || this == REAL || this == IMAG;
    }

    public boolean isSpectral() {
        return this != RAW;
    }

    public static ComponentKind fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Component type is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ComponentKind kind : values()) {
            if (kind.key.equals(normalized) || kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return kind;
            }
        }
        if ("imaginary".equals(normalized)) {
            return IMAG;
        }
        throw new IllegalArgumentException("Unknown component type: " + name);
    }
}
