package com.fourier.mixer.dto;

/**
 * 频域区域选择，坐标为像素坐标（两端包含）
 * <p>
 * 四个坐标都为空时只更新内/外模式
 */
public class RegionRequest {
    private Integer x1;
    private Integer y1;
    private Integer x2;
    private Integer y2;
    private Boolean inner;

    public Integer getX1() { return x1; }
    public void setX1(Integer x1) { this.x1 = x1; }

    public Integer getY1() { return y1; }
    public void setY1(Integer y1) { this.y1 = y1; }

    public Integer getX2() { return x2; }
    public void setX2(Integer x2) { this.x2 = x2; }

    public Integer getY2() { return y2; }
    public void setY2(Integer y2) { this.y2 = y2; }

    public Boolean getInner() { return inner; }
    public void setInner(Boolean inner) { this.inner = inner; }

    public boolean hasRectangle() {
        return x1 != null && y1 != null && x2 != null && y2 != null;
    }

    public boolean hasPartialRectangle() {
        return !hasRectangle() && (x1 != null || y1 != null || x2 != null || y2 != null);
    }
}
