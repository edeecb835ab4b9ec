package com.fourier.mixer.core.image;

import com.fourier.mixer.core.exception.DecodeException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Mat 与 JSON 友好的 double[][] 之间的转换
 */
public final class Matrices {

    private Matrices() {
    }

    /**
     * 行优先的二维数组 -> CV_64F
     *
     * @throws DecodeException 数组为空或不是矩形
     */
    public static Mat fromArray(double[][] rows) {
        if (rows == null || rows.length == 0 || rows[0] == null || rows[0].length == 0) {
            throw new DecodeException("Pixel matrix is empty");
        }
        int height = rows.length;
        int width = rows[0].length;
        double[] data = new double[height * width];
        for (int y = 0; y < height; y++) {
            if (rows[y] == null || rows[y].length != width) {
                throw new DecodeException("Pixel matrix is not rectangular at row " + y);
            }
            System.arraycopy(rows[y], 0, data, y * width, width);
        }
        Mat mat = new Mat(height, width, CvType.CV_64F);
        mat.put(0, 0, data);
        return mat;
    }

    /**
     * 单通道 Mat -> double[][]（任何深度都先转成 CV_64F）
     */
    public static double[][] toArray(Mat mat) {
        Mat source = mat;
        if (mat.type() != CvType.CV_64F) {
            source = new Mat();
            mat.convertTo(source, CvType.CV_64F);
        }
        double[] flat = Spectrum.toArray(source);
        if (source != mat) {
            source.release();
        }

        int height = mat.rows();
        int width = mat.cols();
        double[][] rows = new double[height][width];
        for (int y = 0; y < height; y++) {
            System.arraycopy(flat, y * width, rows[y], 0, width);
        }
        return rows;
    }
}
