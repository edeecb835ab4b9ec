package com.fourier.mixer.core.region;

import com.fourier.mixer.core.image.ImageShape;
import org.opencv.core.Mat;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 记住最近一次框选的矩形和内/外模式，便于按当前统一尺寸生成掩码
 * <p>
 * 非线程安全，由持有者负责同步
 */
public class RegionSelection {
    private RegionRect rectangle;
    private boolean inner = true;

    public void setRectangle(RegionRect rect) {
        this.rectangle = rect == null ? null : rect.normalized();
    }

    public void clearRectangle() {
        this.rectangle = null;
    }

    public boolean hasRectangle() {
        return rectangle != null;
    }

    public RegionRect getRectangle() {
        return rectangle;
    }

    public boolean isInner() {
        return inner;
    }

    public void setInner(boolean inner) {
        this.inner = inner;
    }

    public Mat createMask(ImageShape shape) {
        return RegionMasks.create(shape, rectangle, inner);
    }

    /**
     * 给前端展示的区域信息
     */
    public Map<String, Object> describe() {
        Map<String, Object> info = new LinkedHashMap<>();
        String mode = inner ? "Inner" : "Outer";
        if (rectangle == null) {
            info.put("hasRectangle", false);
            info.put("mode", mode);
            info.put("description", "No region selected (using full image)");
            return info;
        }
        info.put("hasRectangle", true);
        info.put("coordinates", new int[]{rectangle.getX1(), rectangle.getY1(), rectangle.getX2(), rectangle.getY2()});
        info.put("width", rectangle.getWidth());
        info.put("height", rectangle.getHeight());
        info.put("mode", inner ? "Inner (Low Frequencies)" : "Outer (High Frequencies)");
        info.put("description", String.format("Region: %dx%d pixels, Mode: %s",
                rectangle.getWidth(), rectangle.getHeight(), mode));
        return info;
    }
}
