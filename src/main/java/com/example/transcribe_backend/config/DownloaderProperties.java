package com.example.transcribe_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * yt-dlp binary, credential material and the ordered download strategy list.
 * A {@code downloader.strategies} list in configuration replaces the defaults entirely.
 */
@ConfigurationProperties(prefix = "downloader")
public class DownloaderProperties {

    private String ytdlpBin = "yt-dlp";
    /** Netscape cookie file copied into a per-call temp file. */
    private String cookiesFile;
    /** Inline cookie content, takes precedence over {@link #cookiesFile}. */
    private String cookiesContent;
    private long metadataTimeoutSeconds = 30;
    private int socketTimeoutSeconds = 30;
    private List<Strategy> strategies = defaultStrategies();

    public String getYtdlpBin() {
        return ytdlpBin;
    }

    public void setYtdlpBin(String ytdlpBin) {
        this.ytdlpBin = ytdlpBin;
    }

    public String getCookiesFile() {
        return cookiesFile;
    }

    public void setCookiesFile(String cookiesFile) {
        this.cookiesFile = cookiesFile;
    }

    public String getCookiesContent() {
        return cookiesContent;
    }

    public void setCookiesContent(String cookiesContent) {
        this.cookiesContent = cookiesContent;
    }

    public long getMetadataTimeoutSeconds() {
        return metadataTimeoutSeconds;
    }

    public void setMetadataTimeoutSeconds(long metadataTimeoutSeconds) {
        this.metadataTimeoutSeconds = metadataTimeoutSeconds;
    }

    public int getSocketTimeoutSeconds() {
        return socketTimeoutSeconds;
    }

    public void setSocketTimeoutSeconds(int socketTimeoutSeconds) {
        this.socketTimeoutSeconds = socketTimeoutSeconds;
    }

    public List<Strategy> getStrategies() {
        return strategies;
    }

    public void setStrategies(List<Strategy> strategies) {
        this.strategies = strategies;
    }

    /**
     * High-fidelity m4a first, then any audio; each with and without cookies.
     */
    static List<Strategy> defaultStrategies() {
        List<Strategy> list = new ArrayList<>();
        list.add(new Strategy("authenticated-m4a", "Authenticated, high-compatibility format (m4a with cookies)",
                "bestaudio[ext=m4a]/bestaudio", true, "web", 120, 3));
        list.add(new Strategy("unauthenticated-m4a", "Unauthenticated, high-compatibility format (m4a without cookies)",
                "bestaudio[ext=m4a]/bestaudio", false, "android", 120, 3));
        list.add(new Strategy("authenticated-best", "Authenticated, best available format (any format with cookies)",
                "bestaudio/best", true, "web", 120, 3));
        list.add(new Strategy("unauthenticated-best", "Unauthenticated, best available format (any format without cookies)",
                "bestaudio/best", false, "ios", 120, 3));
        return list;
    }

    public static class Strategy {
        private String name;
        private String description;
        private String format;
        private boolean requiresAuth;
        private String clientProfile;
        private long timeoutSeconds = 120;
        private int retries = 3;

        public Strategy() {
        }

        public Strategy(String name, String description, String format, boolean requiresAuth,
                        String clientProfile, long timeoutSeconds, int retries) {
            this.name = name;
            this.description = description;
            this.format = format;
            this.requiresAuth = requiresAuth;
            this.clientProfile = clientProfile;
            this.timeoutSeconds = timeoutSeconds;
            this.retries = retries;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }

        public boolean isRequiresAuth() {
            return requiresAuth;
        }

        public void setRequiresAuth(boolean requiresAuth) {
            this.requiresAuth = requiresAuth;
        }

        public String getClientProfile() {
            return clientProfile;
        }

        public void setClientProfile(String clientProfile) {
            this.clientProfile = clientProfile;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getRetries() {
            return retries;
        }

        public void setRetries(int retries) {
            this.retries = retries;
        }
    }
}
