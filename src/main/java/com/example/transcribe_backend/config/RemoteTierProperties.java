package com.example.transcribe_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Remote accelerated tier. The tier counts as configured only when both base URL and API key are set.
 */
@ConfigurationProperties(prefix = "remote")
public class RemoteTierProperties {
    private String baseUrl;
    private String apiKey;
    private String defaultModel = "htdemucs";
    private long timeoutSeconds = 1800;
    private long healthTimeoutSeconds = 5;

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank() && apiKey != null && !apiKey.isBlank();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public long getHealthTimeoutSeconds() {
        return healthTimeoutSeconds;
    }

    public void setHealthTimeoutSeconds(long healthTimeoutSeconds) {
        this.healthTimeoutSeconds = healthTimeoutSeconds;
    }
}
