package com.example.transcribe_backend.service.download;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Owner-only temporary copy of cookie material for the span of one download call.
 * Closing deletes the file.
 */
final class CredentialFile implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CredentialFile.class);

    private final Path path;

    private CredentialFile(Path path) {
        this.path = path;
    }

    static CredentialFile write(Path dir, String content) throws IOException {
        Files.createDirectories(dir);
        Path tmp;
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            tmp = Files.createTempFile(dir, "cookies-", ".txt",
                    PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
        } else {
            tmp = Files.createTempFile(dir, "cookies-", ".txt");
            var f = tmp.toFile();
            f.setReadable(false, false);
            f.setWritable(false, false);
            f.setReadable(true, true);
            f.setWritable(true, true);
        }
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        return new CredentialFile(tmp);
    }

    Path path() {
        return path;
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.warn("Failed to delete temporary cookie file path={}", path, e);
        }
    }
}
