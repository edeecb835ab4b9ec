package com.fourier.mixer.core.image;

import com.fourier.mixer.core.exception.DecodeException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Base64;

/**
 * 基于 Imgcodecs 的解码实现，直接按灰度读取
 */
@Component
public class OpenCvImageDecoder implements ImageDecoder {
    private static final Logger logger = LoggerFactory.getLogger(OpenCvImageDecoder.class);

    @Override
    public Mat decode(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            throw new DecodeException("Image content is empty");
        }
        MatOfByte mob = new MatOfByte(encoded);
        try {
            Mat image = Imgcodecs.imdecode(mob, Imgcodecs.IMREAD_GRAYSCALE);
            if (image == null || image.empty()) {
                throw new DecodeException("Unsupported or corrupted image data (" + encoded.length + " bytes)");
            }
            logger.debug("Decoded image: {}x{}", image.cols(), image.rows());
            return image;
        } finally {
            mob.release();
        }
    }

    /**
     * 解码 base64 字符串，兼容 "data:image/png;base64,..." 形式的 data URL
     */
    public Mat decodeBase64(String base64) {
        if (base64 == null || base64.isBlank()) {
            throw new DecodeException("No content provided");
        }
        String encoded = base64.contains(",") ? base64.substring(base64.indexOf(',') + 1) : base64;
        byte[] data;
        try {
            data = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Invalid base64 image content", e);
        }
        return decode(data);
    }
}
