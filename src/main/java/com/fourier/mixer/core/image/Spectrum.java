package com.fourier.mixer.core.image;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.List;

/**
 * 频域计算工具
 * <p>
 * 正变换结果始终是零频居中的 CV_64FC2 复数矩阵，所以区域坐标中心 = 低频。
 * 所有方法都返回新分配的 Mat，由调用方负责释放。
 */
public final class Spectrum {

    public static final double DISPLAY_MIN = 0.0;
    public static final double DISPLAY_MAX = 255.0;

    private Spectrum() {
    }

    // ===== 变换 =====

    /**
     * 2D DFT + fftshift
     *
     * @param raw CV_64F 单通道灰度矩阵
     * @return 零频居中的复数频谱 (CV_64FC2)
     */
    public static Mat forward(Mat raw) {
        List<Mat> planes = new ArrayList<>();
        planes.add(raw);
        planes.add(Mat.zeros(raw.size(), CvType.CV_64F));

        Mat complex = new Mat();
        Core.merge(planes, complex);
        planes.get(1).release();

        Core.dft(complex, complex, Core.DFT_COMPLEX_OUTPUT);
        Mat shifted = fftShift(complex);
        complex.release();
        return shifted;
    }

    /**
     * ifftshift + 2D 逆 DFT，取实部并截断到显示范围 [0, 255]
     */
    public static Mat inverse(Mat shiftedSpectrum) {
        Mat unshifted = ifftShift(shiftedSpectrum);
        Mat spatial = new Mat();
        Core.idft(unshifted, spatial, Core.DFT_SCALE | Core.DFT_COMPLEX_OUTPUT);
        unshifted.release();

        List<Mat> planes = new ArrayList<>();
        Core.split(spatial, planes);
        spatial.release();

        Mat real = planes.get(0);
        planes.get(1).release();

        Core.min(real, new Scalar(DISPLAY_MAX), real);
        Core.max(real, new Scalar(DISPLAY_MIN), real);
        return real;
    }

    /**
     * 零频移到中心，奇数尺寸时中心为 (rows/2, cols/2) 向下取整
     */
    public static Mat fftShift(Mat input) {
        return roll(input, input.rows() / 2, input.cols() / 2);
    }

    public static Mat ifftShift(Mat input) {
        return roll(input, -(input.rows() / 2), -(input.cols() / 2));
    }

    /**
     * 循环平移：源 (y, x) 移到 ((y + dy) mod rows, (x + dx) mod cols)
     */
    static Mat roll(Mat src, int dy, int dx) {
        int rows = src.rows();
        int cols = src.cols();
        int shiftY = Math.floorMod(dy, rows);
        int shiftX = Math.floorMod(dx, cols);

        Mat dst = new Mat(src.size(), src.type());

        // {起点, 长度}
        int[][] rowBlocks = {{0, rows - shiftY}, {rows - shiftY, shiftY}};
        int[][] colBlocks = {{0, cols - shiftX}, {cols - shiftX, shiftX}};

        for (int[] rb : rowBlocks) {
            if (rb[1] == 0) continue;
            for (int[] cb : colBlocks) {
                if (cb[1] == 0) continue;
                Mat from = src.submat(new Rect(cb[0], rb[0], cb[1], rb[1]));
                Mat to = dst.submat(new Rect((cb[0] + shiftX) % cols, (rb[0] + shiftY) % rows, cb[1], rb[1]));
                from.copyTo(to);
                from.release();
                to.release();
            }
        }
        return dst;
    }

    // ===== 分量 =====

    public static Mat magnitude(Mat complex) {
        List<Mat> planes = split(complex);
        Mat magnitude = new Mat();
        Core.magnitude(planes.get(0), planes.get(1), magnitude);
        release(planes);
        return magnitude;
    }

    /**
     * 相位 atan2(Im, Re)，取值 (-π, π]
     * <p>
     * Core.phase 返回 [0, 2π) 且精度有限，这里逐元素用 Math.atan2 计算
     */
    public static Mat phase(Mat complex) {
        List<Mat> planes = split(complex);
        double[] re = toArray(planes.get(0));
        double[] im = toArray(planes.get(1));
        release(planes);

        double[] out = new double[re.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = Math.atan2(im[i], re[i]);
        }
        Mat phase = new Mat(complex.rows(), complex.cols(), CvType.CV_64F);
        phase.put(0, 0, out);
        return phase;
    }

    public static Mat real(Mat complex) {
        return plane(complex, 0);
    }

    public static Mat imag(Mat complex) {
        return plane(complex, 1);
    }

    /**
     * magnitude * exp(i * phase)
     */
    public static Mat fromPolar(Mat magnitude, Mat phase) {
        double[] mag = toArray(magnitude);
        double[] ph = toArray(phase);
        double[] re = new double[mag.length];
        double[] im = new double[mag.length];
        for (int i = 0; i < mag.length; i++) {
            re[i] = mag[i] * Math.cos(ph[i]);
            im[i] = mag[i] * Math.sin(ph[i]);
        }

        Mat realPlane = new Mat(magnitude.rows(), magnitude.cols(), CvType.CV_64F);
        realPlane.put(0, 0, re);
        Mat imagPlane = new Mat(magnitude.rows(), magnitude.cols(), CvType.CV_64F);
        imagPlane.put(0, 0, im);
        Mat complex = fromCartesian(realPlane, imagPlane);
        realPlane.release();
        imagPlane.release();
        return complex;
    }

    public static Mat fromCartesian(Mat real, Mat imag) {
        List<Mat> planes = new ArrayList<>();
        planes.add(real);
        planes.add(imag);
        Mat complex = new Mat();
        Core.merge(planes, complex);
        return complex;
    }

    // ===== 显示 =====

    /**
     * 显示用归一化：可选 log(1+|x|) 压缩，min-max 到 [0,1]（常量矩阵输出全 0），再截断到 [0,1]
     */
    public static Mat normalizeForDisplay(Mat data, boolean logCompress) {
        Mat work = new Mat();
        if (logCompress) {
            Mat abs = new Mat();
            Core.absdiff(data, Scalar.all(0), abs);
            Core.add(abs, Scalar.all(1.0), abs);
            Core.log(abs, work);
            abs.release();
        } else {
            data.copyTo(work);
        }

        Core.MinMaxLocResult range = Core.minMaxLoc(work);
        if (range.maxVal > range.minVal) {
            double scale = 1.0 / (range.maxVal - range.minVal);
            work.convertTo(work, CvType.CV_64F, scale, -range.minVal * scale);
        } else {
            work.setTo(Scalar.all(0));
        }
        clamp(work, 0.0, 1.0);
        return work;
    }

    /**
     * 亮度/对比度调整，围绕 0.5 线性缩放，结果仍在 [0,1]
     */
    public static void adjustInPlace(Mat normalized, double brightness, double contrast) {
        if (brightness == 0.0 && contrast == 1.0) {
            return;
        }
        normalized.convertTo(normalized, CvType.CV_64F, contrast, 0.5 - 0.5 * contrast + brightness);
        clamp(normalized, 0.0, 1.0);
    }

    public static void clamp(Mat mat, double lo, double hi) {
        Core.min(mat, new Scalar(hi), mat);
        Core.max(mat, new Scalar(lo), mat);
    }

    // ===== 辅助 =====

    private static Mat plane(Mat complex, int index) {
        List<Mat> planes = split(complex);
        Mat keep = planes.get(index);
        planes.get(1 - index).release();
        return keep;
    }

    private static List<Mat> split(Mat complex) {
        List<Mat> planes = new ArrayList<>();
        Core.split(complex, planes);
        return planes;
    }

    private static void release(List<Mat> mats) {
        for (Mat m : mats) {
            m.release();
        }
    }

    static double[] toArray(Mat mat) {
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        double[] data = new double[(int) continuous.total() * continuous.channels()];
        continuous.get(0, 0, data);
        if (continuous != mat) {
            continuous.release();
        }
        return data;
    }
}
