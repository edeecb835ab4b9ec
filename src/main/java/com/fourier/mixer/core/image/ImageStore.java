package com.fourier.mixer.core.image;

import com.fourier.mixer.core.exception.DecodeException;
import com.fourier.mixer.core.exception.NoImageLoadedException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * 单张图像及其频域缓存
 * <p>
 * 持有三份数据：
 * - original：加载时的像素，尺寸统一时作为重采样的来源，不会被修改
 * - raw：当前（可能已缩放的）灰度矩阵
 * - transform：raw 的零频居中 DFT，及由它派生的幅值/相位/实部/虚部缓存
 * <p>
 * 任何对 raw 的修改都会一次性清空 transform 和全部派生缓存。
 * 所有读写都在同一把实例锁下进行，返回的 Mat 均为副本，由调用方释放。
 */
public class ImageStore {
    private static final Logger logger = LoggerFactory.getLogger(ImageStore.class);

    private final Object lock = new Object();

    private ImageState state = ImageState.EMPTY;
    private Mat original;
    private Mat raw;
    private Mat transform;
    private final Map<ComponentKind, Mat> componentCache = new EnumMap<>(ComponentKind.class);

    /**
     * 替换像素数据并清空所有缓存
     *
     * @param pixels 解码得到的灰度矩阵，多通道会先转为灰度
     * @throws DecodeException 解码方没有产出矩阵
     */
    public void load(Mat pixels) {
        if (pixels == null || pixels.empty()) {
            throw new DecodeException("Decoder produced no image matrix");
        }
        Mat gray = toGrayDouble(pixels);

        synchronized (lock) {
            releaseMat(original);
            releaseMat(raw);
            invalidateSpectrum();
            original = gray;
            raw = gray.clone();
            state = ImageState.RAW_ONLY;
        }
        logger.debug("Image loaded: shape={}", ImageShape.of(gray));
    }

    /**
     * 重采样到目标尺寸，始终从原始像素出发，缩小用 INTER_AREA，放大用 INTER_LANCZOS4。
     * 未加载图像时不做任何事。
     */
    public void resize(ImageShape target) {
        synchronized (lock) {
            if (state == ImageState.EMPTY) {
                return;
            }

            ImageShape originalShape = ImageShape.of(original);
            Mat resized;
            if (originalShape.equals(target)) {
                resized = original.clone();
            } else {
                int interpolation = target.fitsWithin(originalShape) ? Imgproc.INTER_AREA : Imgproc.INTER_LANCZOS4;
                resized = new Mat();
                Imgproc.resize(original, resized, target.toSize(), 0, 0, interpolation);
            }

            releaseMat(raw);
            invalidateSpectrum();
            raw = resized;
            state = ImageState.RAW_ONLY;
            logger.debug("Image resized: {} -> {}", originalShape, target);
        }
    }

    /**
     * 获取分量数据（副本）
     * <p>
     * 频域分量在首次请求时计算 DFT，派生分量按需计算并缓存
     *
     * @throws NoImageLoadedException 尚未加载图像
     */
    public Mat getComponent(ComponentKind kind) {
        synchronized (lock) {
            if (state == ImageState.EMPTY) {
                throw new NoImageLoadedException();
            }
            if (!kind.isSpectral()) {
                return raw.clone();
            }

            Mat cached = componentCache.get(kind);
            if (cached == null) {
                ensureTransform();
                cached = computeComponent(kind);
                componentCache.put(kind, cached);
                logger.debug("Cached {} component for shape {}", kind.getKey(), ImageShape.of(raw));
            }
            return cached.clone();
        }
    }

    /**
     * 显示用数据，取值 [0,1]
     * <p>
     * magnitude/real/imag 先做 log(1+|x|) 压缩，phase 和 raw 直接归一化。
     * 每次都从未压缩的分量重新计算，不会重复叠加 log。
     */
    public Mat getDisplayComponent(ComponentKind kind) {
        return getDisplayComponent(kind, 0.0, 1.0);
    }

    public Mat getDisplayComponent(ComponentKind kind, double brightness, double contrast) {
        Mat data = getComponent(kind);
        try {
            Mat display = Spectrum.normalizeForDisplay(data, kind.isLogCompressed());
            Spectrum.adjustInPlace(display, brightness, contrast);
            return display;
        } finally {
            data.release();
        }
    }

    public ImageState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isLoaded() {
        return getState() != ImageState.EMPTY;
    }

    /**
     * 当前尺寸，未加载时为 null
     */
    public ImageShape getShape() {
        synchronized (lock) {
            return raw == null ? null : ImageShape.of(raw);
        }
    }

    /**
     * 加载时的尺寸，尺寸统一以它为准
     */
    public ImageShape getOriginalShape() {
        synchronized (lock) {
            return original == null ? null : ImageShape.of(original);
        }
    }

    /**
     * 释放全部 native 内存，回到 EMPTY 状态
     */
    public void release() {
        synchronized (lock) {
            releaseMat(original);
            releaseMat(raw);
            invalidateSpectrum();
            original = null;
            raw = null;
            state = ImageState.EMPTY;
        }
    }

    // ===== 内部 =====

    private void ensureTransform() {
        if (state == ImageState.RAW_ONLY) {
            transform = Spectrum.forward(raw);
            state = ImageState.TRANSFORM_COMPUTED;
        }
    }

    private Mat computeComponent(ComponentKind kind) {
        switch (kind) {
            case MAGNITUDE:
                return Spectrum.magnitude(transform);
            case PHASE:
                return Spectrum.phase(transform);
            case REAL:
                return Spectrum.real(transform);
            case IMAG:
                return Spectrum.imag(transform);
            default:
                throw new IllegalArgumentException("Not a spectral component: " + kind);
        }
    }

    private void invalidateSpectrum() {
        releaseMat(transform);
        transform = null;
        for (Mat m : componentCache.values()) {
            m.release();
        }
        componentCache.clear();
    }

    private static Mat toGrayDouble(Mat pixels) {
        Mat gray;
        switch (pixels.channels()) {
            case 1:
                gray = pixels;
                break;
            case 3:
            case 4:
                Mat asFloat = new Mat();
                pixels.convertTo(asFloat, CvType.CV_32F);
                gray = new Mat();
                Imgproc.cvtColor(asFloat, gray,
                        pixels.channels() == 3 ? Imgproc.COLOR_BGR2GRAY : Imgproc.COLOR_BGRA2GRAY);
                asFloat.release();
                break;
            default:
                throw new DecodeException("Unsupported channel count: " + pixels.channels());
        }

        Mat result = new Mat();
        gray.convertTo(result, CvType.CV_64F);
        if (gray != pixels) {
            gray.release();
        }
        return result;
    }

    private static void releaseMat(Mat mat) {
        if (mat != null) {
            mat.release();
        }
    }
}
