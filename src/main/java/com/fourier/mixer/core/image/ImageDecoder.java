package com.fourier.mixer.core.image;

import org.opencv.core.Mat;

/**
 * 外部图像解码协作方：编码字节 -> 灰度强度矩阵
 */
public interface ImageDecoder {

    /**
     * 解码图像
     *
     * @param encoded 图像文件字节（PNG/JPEG/BMP 等）
     * @return 单通道灰度矩阵
     * @throws com.fourier.mixer.core.exception.DecodeException 数据无法解码
     */
    Mat decode(byte[] encoded);
}
