package com.fourier.mixer.core.mixer;

import com.fourier.mixer.core.exception.EmptyImageSetException;
import com.fourier.mixer.core.exception.NoImageLoadedException;
import com.fourier.mixer.core.exception.ShapeMismatchException;
import com.fourier.mixer.core.image.ComponentKind;
import com.fourier.mixer.core.image.ImageShape;
import com.fourier.mixer.core.image.ImageStore;
import com.fourier.mixer.core.image.Spectrum;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;

/**
 * 频域混合与重建
 * <p>
 * 流程：
 * 1. 对两个分量分别按权重加权平均（权重只在实际存在的图像上归一化）
 * 2. 应用区域掩码（MAG_PHASE 只作用于幅值，REAL_IMAG 作用于实部和虚部）
 * 3. 重建复数频谱，ifftshift + 逆 DFT，取实部并截断到 [0, 255]
 * <p>
 * 无状态，只读取各 ImageStore 的缓存分量
 */
@Component
public class MixingEngine {
    private static final Logger logger = LoggerFactory.getLogger(MixingEngine.class);

    /**
     * 执行混合并返回空间域图像 (CV_64F, 取值 [0,255])
     *
     * @throws EmptyImageSetException 没有图像
     * @throws ShapeMismatchException 掩码或图像尺寸与参考图像不一致
     */
    public Mat mix(MixRequest request) {
        long start = System.currentTimeMillis();
        MixedComponents mixed = mixComponents(request);
        try {
            Mat result = reconstruct(mixed);
            logger.debug("Mix finished in {} ms: {}", System.currentTimeMillis() - start, request);
            return result;
        } finally {
            mixed.release();
        }
    }

    /**
     * 只做加权和掩码，不重建
     */
    public MixedComponents mixComponents(MixRequest request) {
        NavigableMap<Integer, ImageStore> images = request.getImages();
        if (images.isEmpty()) {
            throw new EmptyImageSetException();
        }

        ImageStore reference = images.firstEntry().getValue();
        ImageShape shape = reference.getShape();
        if (shape == null) {
            throw new NoImageLoadedException();
        }

        Mat mask = request.getMask();
        if (mask != null && !shape.equals(ImageShape.of(mask))) {
            throw new ShapeMismatchException("Mask", shape, ImageShape.of(mask));
        }

        MixMode mode = request.getMode();
        Mat first = blend(mode.first(), request.getComponent1Weights(), images, reference, shape);
        Mat second;
        try {
            second = blend(mode.second(), request.getComponent2Weights(), images, reference, shape);
        } catch (RuntimeException e) {
            first.release();
            throw e;
        }

        if (mask != null) {
            Mat typedMask = asDouble(mask);
            switch (mode) {
                case MAG_PHASE:
                    // 只对幅值加掩码，相位保持不变
                    Core.multiply(first, typedMask, first);
                    break;
                case REAL_IMAG:
                    Core.multiply(first, typedMask, first);
                    Core.multiply(second, typedMask, second);
                    break;
                default:
                    throw new IllegalStateException("Unhandled mode: " + mode);
            }
            if (typedMask != mask) {
                typedMask.release();
            }
        }

        return new MixedComponents(mode, first, second);
    }

    /**
     * 由混合分量重建空间域图像
     */
    public Mat reconstruct(MixedComponents mixed) {
        Mat spectrum;
        switch (mixed.getMode()) {
            case MAG_PHASE:
                spectrum = Spectrum.fromPolar(mixed.getFirst(), mixed.getSecond());
                break;
            case REAL_IMAG:
                spectrum = Spectrum.fromCartesian(mixed.getFirst(), mixed.getSecond());
                break;
            default:
                throw new IllegalStateException("Unhandled mode: " + mixed.getMode());
        }
        try {
            return Spectrum.inverse(spectrum);
        } finally {
            spectrum.release();
        }
    }

    /**
     * 加权平均一个分量
     * <p>
     * 不在 images 中的槽位直接忽略；有效权重和为 0 时使用参考图像的原始分量
     */
    private Mat blend(ComponentKind kind, Map<Integer, Double> weights,
                      NavigableMap<Integer, ImageStore> images, ImageStore reference, ImageShape shape) {
        Map<Integer, Double> effective = new LinkedHashMap<>();
        double total = 0.0;
        for (Map.Entry<Integer, Double> entry : weights.entrySet()) {
            if (!images.containsKey(entry.getKey())) {
                continue;
            }
            Double weight = entry.getValue();
            if (weight == null || weight.isNaN() || weight < 0) {
                throw new IllegalArgumentException("Weight for slot " + entry.getKey() + " must be non-negative: " + weight);
            }
            if (weight == 0.0) {
                continue;
            }
            effective.put(entry.getKey(), weight);
            total += weight;
        }

        if (total <= 0.0) {
            logger.debug("No weights configured for {}, using first image as-is", kind.getKey());
            return reference.getComponent(kind);
        }

        Mat accumulator = Mat.zeros(shape.getHeight(), shape.getWidth(), CvType.CV_64F);
        try {
            for (Map.Entry<Integer, Double> entry : effective.entrySet()) {
                Mat component = images.get(entry.getKey()).getComponent(kind);
                try {
                    ImageShape componentShape = ImageShape.of(component);
                    if (!shape.equals(componentShape)) {
                        throw new ShapeMismatchException("Image in slot " + entry.getKey(), shape, componentShape);
                    }
                    Core.scaleAdd(component, entry.getValue() / total, accumulator, accumulator);
                } finally {
                    component.release();
                }
            }
        } catch (RuntimeException e) {
            accumulator.release();
            throw e;
        }
        return accumulator;
    }

    private static Mat asDouble(Mat mask) {
        if (mask.type() == CvType.CV_64F) {
            return mask;
        }
        Mat converted = new Mat();
        mask.convertTo(converted, CvType.CV_64F);
        return converted;
    }
}
