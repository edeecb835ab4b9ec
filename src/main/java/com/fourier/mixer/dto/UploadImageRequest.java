package com.fourier.mixer.dto;

/**
 * 图像上传请求
 * <p>
 * image 和 pixels 二选一：image 为 base64（可带 data URL 前缀），pixels 为已解码的灰度矩阵
 */
public class UploadImageRequest {
    private String image;
    private double[][] pixels;
    private String component;   // 返回的频域显示分量，默认 magnitude

    public String getImage() { return image; }
    public void setImage(String image) { this.image = image; }

    public double[][] getPixels() { return pixels; }
    public void setPixels(double[][] pixels) { this.pixels = pixels; }

    public String getComponent() { return component; }
    public void setComponent(String component) { this.component = component; }
}
