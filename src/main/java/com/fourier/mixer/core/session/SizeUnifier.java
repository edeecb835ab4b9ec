package com.fourier.mixer.core.session;

import com.fourier.mixer.core.image.ImageShape;
import com.fourier.mixer.core.image.ImageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 统一所有图像尺寸，频域混合前频谱必须同尺寸
 * <p>
 * 最小尺寸总是从各图像的原始尺寸重新计算，
 * 因此移除小图或加入大图后统一尺寸可以回升，不会只减不增。
 */
@Component
public class SizeUnifier {
    private static final Logger logger = LoggerFactory.getLogger(SizeUnifier.class);

    public void enforceUnifiedSize(SessionRegistry registry) {
        List<ImageStore> images = registry.getAllImages();
        if (images.isEmpty()) {
            return;
        }

        ImageShape minShape = findMinDimensions(images);
        ImageShape previous = registry.getCommonShape();
        registry.updateCommonShape(minShape);
        if (!minShape.equals(previous)) {
            logger.info("Unified image shape: {} -> {}", previous, minShape);
        }

        int resized = 0;
        for (ImageStore image : images) {
            if (!minShape.equals(image.getShape())) {
                image.resize(minShape);
                resized++;
            }
        }
        if (resized > 0) {
            logger.debug("Resized {} image(s) to {}", resized, minShape);
        }
    }

    ImageShape findMinDimensions(List<ImageStore> images) {
        int minHeight = Integer.MAX_VALUE;
        int minWidth = Integer.MAX_VALUE;
        for (ImageStore image : images) {
            ImageShape shape = image.getOriginalShape();
            if (shape == null) {
                continue;
            }
            minHeight = Math.min(minHeight, shape.getHeight());
            minWidth = Math.min(minWidth, shape.getWidth());
        }
        if (minHeight == Integer.MAX_VALUE) {
            throw new IllegalStateException("No loaded image to derive a common shape from");
        }
        return new ImageShape(minHeight, minWidth);
    }
}
