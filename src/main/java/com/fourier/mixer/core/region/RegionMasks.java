package com.fourier.mixer.core.region;

import com.fourier.mixer.core.image.ImageShape;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

/**
 * 频域区域掩码
 * <p>
 * 频谱已零频居中，因此：
 * - inner：矩形内为 1，保留低频
 * - outer：矩形内为 0，保留高频
 */
public final class RegionMasks {

    private RegionMasks() {
    }

    /**
     * 构建 CV_64F 掩码，取值只有 0.0 和 1.0
     *
     * @param shape 目标尺寸
     * @param rect  矩形，null 表示不限区域（全 1）
     * @param inner true 保留矩形内部，false 保留外部
     */
    public static Mat create(ImageShape shape, RegionRect rect, boolean inner) {
        int rows = shape.getHeight();
        int cols = shape.getWidth();

        if (rect == null) {
            return Mat.ones(rows, cols, CvType.CV_64F);
        }

        int x1 = clamp(rect.getX1(), cols - 1);
        int y1 = clamp(rect.getY1(), rows - 1);
        int x2 = clamp(rect.getX2(), cols - 1);
        int y2 = clamp(rect.getY2(), rows - 1);

        int left = Math.min(x1, x2);
        int right = Math.max(x1, x2);
        int top = Math.min(y1, y2);
        int bottom = Math.max(y1, y2);

        Mat mask = new Mat(rows, cols, CvType.CV_64F, new Scalar(inner ? 0.0 : 1.0));
        Mat roi = mask.submat(new Rect(left, top, right - left + 1, bottom - top + 1));
        roi.setTo(new Scalar(inner ? 1.0 : 0.0));
        roi.release();
        return mask;
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }
}
