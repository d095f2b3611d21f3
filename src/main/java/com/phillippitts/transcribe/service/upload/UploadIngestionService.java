package com.phillippitts.transcribe.service.upload;

import com.phillippitts.transcribe.config.properties.UploadProperties;
import com.phillippitts.transcribe.domain.TempArtifact;
import com.phillippitts.transcribe.exception.FileTooLargeException;
import com.phillippitts.transcribe.exception.StorageException;
import com.phillippitts.transcribe.exception.UnsupportedFormatException;
import com.phillippitts.transcribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Streams uploads to transient storage under a byte ceiling.
 *
 * <p>The upload is copied chunk by chunk; the running total is checked before each chunk
 * is written, so neither memory nor disk ever holds more than the configured maximum.
 * The client-declared content length is never trusted. On any failure the partial file
 * is deleted before the exception leaves this class.
 */
@Service
public class UploadIngestionService {

    private static final Logger LOG = LogManager.getLogger(UploadIngestionService.class);

    private static final String TEMP_PREFIX = "audio_";

    private final UploadProperties props;

    public UploadIngestionService(UploadProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Validates that the filename is present and carries an allowed extension.
     * Reads no bytes.
     *
     * @param filename client-declared filename, may be null
     * @return the lowercase extension without the dot
     * @throws UnsupportedFormatException if the filename is missing or the extension is not allowed
     */
    public String checkFormat(String filename) {
        List<String> allowed = props.allowedFormats();
        if (filename == null || filename.isBlank()) {
            throw new UnsupportedFormatException("File must have a filename", allowed);
        }
        String extension = extensionOf(filename);
        if (!allowed.contains(extension)) {
            throw UnsupportedFormatException.forExtension(extension, allowed);
        }
        return extension;
    }

    /**
     * Copies the stream to a fresh file in the temp directory.
     *
     * <p>Ownership of the returned file passes to the caller, who must {@link #discard} it.
     *
     * @param source upload body; not closed by this method
     * @param filename client-declared filename
     * @return the staged file and its size
     * @throws UnsupportedFormatException before any read when the filename is rejected
     * @throws FileTooLargeException when the running total exceeds the limit (partial file deleted)
     * @throws StorageException on any other I/O failure (partial file deleted)
     */
    public TempArtifact ingest(InputStream source, String filename) {
        String extension = checkFormat(filename);
        long maxBytes = props.maxFileSizeBytes();
        Path target = Path.of(props.tempDir()).resolve(TEMP_PREFIX + UUID.randomUUID() + "." + extension);
        long total = 0;
        boolean complete = false;

        try {
            Files.createDirectories(target.getParent());
            try (OutputStream out = Files.newOutputStream(target,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                byte[] buffer = new byte[props.chunkSizeBytes()];
                int read;
                while ((read = source.read(buffer)) != -1) {
                    total += read;
                    if (total > maxBytes) {
                        LOG.info("Upload '{}' rejected: exceeded {} bytes", LogSanitizer.filename(filename), maxBytes);
                        throw new FileTooLargeException(maxBytes);
                    }
                    out.write(buffer, 0, read);
                }
            }
            complete = true;
            LOG.debug("Upload '{}' staged at {} ({} bytes)", LogSanitizer.filename(filename), target, total);
            return new TempArtifact(target, total);
        } catch (IOException e) {
            throw new StorageException("Failed to save uploaded file: " + e.getMessage(), e);
        } finally {
            if (!complete) {
                deletePartial(target);
            }
        }
    }

    /**
     * Deletes a staged file. Never throws.
     *
     * @param artifact staged file, may be null
     * @return true if the file is gone afterwards, false if deletion failed
     */
    public boolean discard(TempArtifact artifact) {
        if (artifact == null) {
            return true;
        }
        try {
            Files.deleteIfExists(artifact.path());
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not delete temp file {}: {}", artifact.path(), e.toString());
            return false;
        }
    }

    /**
     * Returns the lowercase text after the last dot of the base name, or "" when the
     * base name has no extension (no dot, a leading dot only, or a trailing dot).
     */
    static String extensionOf(String filename) {
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String base = filename.substring(slash + 1);
        int dot = base.lastIndexOf('.');
        if (dot <= 0 || dot == base.length() - 1) {
            return "";
        }
        return base.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static void deletePartial(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            LOG.warn("Could not delete partial upload {}: {}", target, e.toString());
        }
    }
}
