package com.fourier.mixer.dto;

public class WeightRequest {
    private Double weight;   // [0, 1]
    private String group;    // first/second，为空时保持原分组

    public Double getWeight() { return weight; }
    public void setWeight(Double weight) { this.weight = weight; }

    public String getGroup() { return group; }
    public void setGroup(String group) { this.group = group; }
}
