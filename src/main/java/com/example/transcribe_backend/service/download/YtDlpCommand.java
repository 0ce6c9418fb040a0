package com.example.transcribe_backend.service.download;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds yt-dlp argument lists. Audio is always extracted to mp3 at best quality.
 */
public final class YtDlpCommand {
    private final String bin;
    private String url;
    private String format;
    private Path outputTemplate;
    private Path cookies;
    private String clientProfile;
    private int retries = 3;
    private int socketTimeoutSeconds = 30;

    private YtDlpCommand(String bin) {
        this.bin = Objects.requireNonNull(bin, "bin");
    }

    public static YtDlpCommand of(String bin) {
        return new YtDlpCommand(bin);
    }

    public YtDlpCommand url(String url) {
        this.url = url;
        return this;
    }

    public YtDlpCommand format(String format) {
        this.format = format;
        return this;
    }

    /** Output template without extension; yt-dlp appends {@code .%(ext)s}. */
    public YtDlpCommand output(Path basePath) {
        this.outputTemplate = basePath;
        return this;
    }

    public YtDlpCommand cookies(Path cookies) {
        this.cookies = cookies;
        return this;
    }

    public YtDlpCommand clientProfile(String clientProfile) {
        this.clientProfile = clientProfile;
        return this;
    }

    public YtDlpCommand retries(int retries) {
        this.retries = retries;
        return this;
    }

    public YtDlpCommand socketTimeoutSeconds(int socketTimeoutSeconds) {
        this.socketTimeoutSeconds = socketTimeoutSeconds;
        return this;
    }

    public List<String> buildDownload() {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(outputTemplate, "output");
        List<String> cmd = new ArrayList<>(List.of(
                bin,
                "-f", format,
                "-x",
                "--audio-format", "mp3",
                "--audio-quality", "0",
                "-o", outputTemplate + ".%(ext)s",
                "--no-playlist",
                "--no-progress",
                "--no-check-certificate",
                "--socket-timeout", String.valueOf(socketTimeoutSeconds),
                "--retries", String.valueOf(retries)
        ));
        if (clientProfile != null && !clientProfile.isBlank()) {
            cmd.add("--extractor-args");
            cmd.add("youtube:player_client=" + clientProfile);
        }
        if (cookies != null) {
            cmd.add("--cookies");
            cmd.add(cookies.toString());
        }
        cmd.add(url);
        return cmd;
    }

    /** {@code title|duration} on a single stdout line, nothing downloaded. */
    public List<String> buildMetadata() {
        Objects.requireNonNull(url, "url");
        List<String> cmd = new ArrayList<>(List.of(
                bin,
                "--skip-download",
                "--print", "%(title)s|%(duration)s",
                "--no-playlist",
                "--socket-timeout", String.valueOf(socketTimeoutSeconds)
        ));
        if (cookies != null) {
            cmd.add("--cookies");
            cmd.add(cookies.toString());
        }
        cmd.add(url);
        return cmd;
    }

    public List<String> buildVersion() {
        return List.of(bin, "--version");
    }
}
