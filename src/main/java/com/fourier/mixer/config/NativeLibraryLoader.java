package com.fourier.mixer.config;

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责在使用任何 OpenCV 类之前加载 JNI 库
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    /**
     * 预加载 OpenCV native 库，可重复调用
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        // JAR 模式下，使用 openpnp 打包的库（解压到临时目录后加载）
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            logger.info("OpenCV {} loaded successfully via openpnp", Core.VERSION);
            return;
        } catch (Throwable e) {
            logger.warn("Failed to load OpenCV via openpnp: {}", e.getMessage());
        }

        // 回退到系统库路径
        try {
            System.loadLibrary(Core.NATIVE_LIBRARY_NAME);
            loaded = true;
            logger.info("OpenCV loaded successfully from system library path");
        } catch (UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV library. Please ensure {} is in the system library path",
                    Core.NATIVE_LIBRARY_NAME);
            throw new RuntimeException("OpenCV native library not found: " + Core.NATIVE_LIBRARY_NAME, e);
        }
    }
}
