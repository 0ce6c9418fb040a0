package com.example.transcribe_backend.service.Interfaces;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public interface StorageService {

    /**
     * Stores content under a logical path such as {@code transcriptions/<jobId>/results.json}.
     *
     * @return key and retrievable URI of the stored object.
     */
    StoredObject upload(byte[] content, String logicalPath, String contentType);

    default StoredObject uploadText(String content, String logicalPath, String contentType) {
        return upload(content.getBytes(StandardCharsets.UTF_8), logicalPath, contentType);
    }

    boolean exists(String logicalPath);

    Path resolve(String logicalPath);

    record StoredObject(String key, URI uri) {
    }
}
