package com.fourier.mixer;

import com.fourier.mixer.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FourierMixerApplication {

    public static void main(String[] args) {
        // 必须在任何 OpenCV 调用之前加载
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(FourierMixerApplication.class, args);
    }
}
