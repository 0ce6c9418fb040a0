package com.example.transcribe_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Embedding calls share the audio client (base URL, key, connection pool); only the model and limits differ.
 */
@ConfigurationProperties(prefix = "openai.embedding")
public class OpenAIEmbeddingProperties {

    private String model = "text-embedding-3-small";
    private int batchSize = 100;
    private long timeoutSeconds = 60;

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
