package com.phillippitts.transcribe.config.properties;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Locale;

/**
 * Limits and scratch storage for uploaded audio.
 * Binds to properties prefixed with "upload".
 *
 * @param maxFileSizeMb Maximum accepted upload size in megabytes
 * @param allowedFormats Accepted file extensions, without the dot
 * @param tempDir Directory receiving in-flight uploads; blank means {@code java.io.tmpdir}
 * @param chunkSizeBytes Size of each streamed copy chunk
 */
@ConfigurationProperties(prefix = "upload")
@Validated
public record UploadProperties(
        @DefaultValue("25")
        @Positive(message = "Max file size must be positive")
        int maxFileSizeMb,

        @DefaultValue({"mp3", "wav", "m4a", "ogg", "flac", "webm"})
        @NotEmpty(message = "At least one audio format must be allowed")
        List<String> allowedFormats,

        @DefaultValue("")
        String tempDir,

        @DefaultValue("8192")
        @Positive(message = "Chunk size must be positive")
        int chunkSizeBytes
) {
    private static final long BYTES_PER_MB = 1024L * 1024L;

    public UploadProperties {
        allowedFormats = allowedFormats == null ? List.of() : allowedFormats.stream()
                .map(f -> f.trim().toLowerCase(Locale.ROOT))
                .filter(f -> !f.isEmpty())
                .toList();
        if (tempDir == null || tempDir.isBlank()) {
            tempDir = System.getProperty("java.io.tmpdir");
        }
    }

    public long maxFileSizeBytes() {
        return maxFileSizeMb * BYTES_PER_MB;
    }
}
