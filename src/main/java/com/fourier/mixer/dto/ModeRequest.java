package com.fourier.mixer.dto;

public class ModeRequest {
    private String mode;   // mag_phase / real_imag

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }
}
