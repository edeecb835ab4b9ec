package com.fourier.mixer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "ft-mixer")
public class MixerConfig {
    private SessionConfig session = new SessionConfig();
    private JobConfig job = new JobConfig();
    private CorsConfig cors = new CorsConfig();

    @Data
    public static class SessionConfig {
        private int slots = 4;
        private double defaultWeight = 0.25;
        private String defaultMode = "MAG_PHASE";
        private String defaultDisplayComponent = "magnitude";
    }

    @Data
    public static class JobConfig {
        // 取消旧任务时最多等待的时间
        private long cancelJoinMillis = 100;
    }

    @Data
    public static class CorsConfig {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
