package com.fourier.mixer.core.image;

import org.opencv.core.Mat;
import org.opencv.core.Size;

import java.util.Objects;

/**
 * 图像尺寸 (height, width)
 */
public final class ImageShape {
    private final int height;
    private final int width;

    public ImageShape(int height, int width) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Invalid image shape: " + height + "x" + width);
        }
        this.height = height;
        this.width = width;
    }

    public static ImageShape of(Mat mat) {
        return new ImageShape(mat.rows(), mat.cols());
    }

    public int getHeight() { return height; }
    public int getWidth() { return width; }

    /**
     * OpenCV 的 Size 是 (width, height) 顺序
     */
    public Size toSize() {
        return new Size(width, height);
    }

    public boolean fitsWithin(ImageShape other) {
        return height <= other.height && width <= other.width;
    }

    public int[] toArray() {
        return new int[]{height, width};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageShape)) return false;
        ImageShape that = (ImageShape) o;
        return height == that.height && width == that.width;
    }

    @Override
    public int hashCode() {
        return Objects.hash(height, width);
    }

    @Override
    public String toString() {
        return "(" + height + ", " + width + ")";
    }
}
