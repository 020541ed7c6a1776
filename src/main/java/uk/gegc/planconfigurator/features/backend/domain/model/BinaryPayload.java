package uk.gegc.planconfigurator.features.backend.domain.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * File content travelling inside a request body. Its presence switches the request to
 * multipart form data.
 */
public record BinaryPayload(String fileName, String contentType, byte[] content) {

    public BinaryPayload {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
        contentType = contentType == null ? "application/octet-stream" : contentType;
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryPayload that)) return false;
        return fileName.equals(that.fileName)
                && contentType.equals(that.contentType)
                && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileName, contentType, Arrays.hashCode(content));
    }

    @Override
    public String toString() {
        return "BinaryPayload[fileName=" + fileName + ", contentType=" + contentType + ", size=" + content.length + "]";
    }
}
