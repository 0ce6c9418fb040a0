package com.example.transcribe_backend.config;

import com.example.transcribe_backend.service.Interfaces.StorageService;
import com.example.transcribe_backend.service.LocalStorageService;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public StorageService storageService(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        var svc = new LocalStorageService(base);
        LoggerFactory.getLogger(StorageConfig.class)
                .info("Storage wired: base={}, resultsPrefix={}", base, properties.getResultsPrefix());
        return svc;
    }
}
