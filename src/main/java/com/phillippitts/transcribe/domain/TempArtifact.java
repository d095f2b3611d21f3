package com.phillippitts.transcribe.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An uploaded file staged in transient storage for the lifetime of one request.
 *
 * @param path     location of the staged file
 * @param byteSize number of bytes written
 */
public record TempArtifact(Path path, long byteSize) {

    public TempArtifact {
        Objects.requireNonNull(path, "path must not be null");
        if (byteSize < 0) {
            throw new IllegalArgumentException("byteSize must be >= 0, got: " + byteSize);
        }
    }
}
