package com.example.transcribe_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    private String baseDir = "./data";
    private String resultsPrefix = "transcriptions";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getResultsPrefix() { return resultsPrefix; }
    public void setResultsPrefix(String resultsPrefix) { this.resultsPrefix = resultsPrefix; }
}
