package com.fourier.mixer.core.region;

import java.util.Objects;

/**
 * 像素坐标下的矩形 (x1, y1, x2, y2)，两端均包含
 * <p>
 * 坐标顺序不做要求，构建掩码时再规整
 */
public final class RegionRect {
    private final int x1;
    private final int y1;
    private final int x2;
    private final int y2;

    public RegionRect(int x1, int y1, int x2, int y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    /**
     * 按 min/max 规整后的矩形
     */
    public RegionRect normalized() {
        return new RegionRect(Math.min(x1, x2), Math.min(y1, y2), Math.max(x1, x2), Math.max(y1, y2));
    }

    public int getX1() { return x1; }
    public int getY1() { return y1; }
    public int getX2() { return x2; }
    public int getY2() { return y2; }

    public int getWidth() {
        return Math.abs(x2 - x1);
    }

    public int getHeight() {
        return Math.abs(y2 - y1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RegionRect)) return false;
        RegionRect that = (RegionRect) o;
        return x1 == that.x1 && y1 == that.y1 && x2 == that.x2 && y2 == that.y2;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x1, y1, x2, y2);
    }

    @Override
    public String toString() {
        return "RegionRect[" + x1 + "," + y1 + " - " + x2 + "," + y2 + "]";
    }
}
