package com.fourier.mixer.core.mixer;

import com.fourier.mixer.core.image.ImageStore;
import org.opencv.core.Mat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 一次混合的全部输入
 * <p>
 * 权重是 槽位 -> 非负权重；images 按槽位排序，第一个作为参考图像。
 * mask 可为 null，由调用方持有。
 */
public class MixRequest {
    private final MixMode mode;
    private final Map<Integer, Double> component1Weights;
    private final Map<Integer, Double> component2Weights;
    private final NavigableMap<Integer, ImageStore> images;
    private final Mat mask;

    public MixRequest(MixMode mode,
                      Map<Integer, Double> component1Weights,
                      Map<Integer, Double> component2Weights,
                      NavigableMap<Integer, ImageStore> images,
                      Mat mask) {
        if (mode == null) {
            throw new IllegalArgumentException("Mix mode is required");
        }
        this.mode = mode;
        this.component1Weights = copy(component1Weights);
        this.component2Weights = copy(component2Weights);
        this.images = images == null
                ? Collections.emptyNavigableMap()
                : Collections.unmodifiableNavigableMap(new TreeMap<>(images));
        this.mask = mask;
    }

    public MixMode getMode() { return mode; }
    public Map<Integer, Double> getComponent1Weights() { return component1Weights; }
    public Map<Integer, Double> getComponent2Weights() { return component2Weights; }
    public NavigableMap<Integer, ImageStore> getImages() { return images; }
    public Mat getMask() { return mask; }

    private static Map<Integer, Double> copy(Map<Integer, Double> weights) {
        return weights == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    @Override
    public String toString() {
        return "MixRequest{" +
                "mode=" + mode +
                ", component1=" + component1Weights +
                ", component2=" + component2Weights +
                ", slots=" + images.keySet() +
                ", masked=" + (mask != null) +
                '}';
    }
}
