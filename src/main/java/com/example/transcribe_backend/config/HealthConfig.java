package com.example.transcribe_backend.config;

import com.example.transcribe_backend.service.download.AudioDownloadService;
import com.example.transcribe_backend.service.remote.RemoteTierClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator ytDlpHealth(AudioDownloadService downloader) {
        return () -> downloader.isAvailable()
                ? Health.up().withDetail("yt-dlp", "ok").build()
                : Health.down().withDetail("yt-dlp", "missing").build();
    }

    @Bean
    public HealthIndicator remoteTierHealth(RemoteTierClient remote) {
        return () -> {
            if (!remote.isConfigured()) {
                return Health.unknown().withDetail("remoteTier", "not configured").build();
            }
            return remote.isHealthy()
                    ? Health.up().withDetail("remoteTier", "ok").build()
                    : Health.down().withDetail("remoteTier", "unreachable").build();
        };
    }
}
