package com.example.trackscribe.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the WhisperX-compatible transcription service.
 */
@ConfigurationProperties(prefix = "asr")
public class AsrProperties {
    private String baseUrl = "http://127.0.0.1:9000";
    private String model = "large-v2";
    private int batchSize = 16;
    private long timeoutSeconds = 1800;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}
