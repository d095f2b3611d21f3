package com.phillippitts.transcribe.service.orchestration;

import com.phillippitts.transcribe.domain.TranscriptionParams;
import com.phillippitts.transcribe.domain.TranscriptionResult;

import java.io.InputStream;

/**
 * Runs one transcription request end to end.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>Validate the filename and format (no bytes read)</li>
 *   <li>Stream the upload to a temp file under the size ceiling</li>
 *   <li>Resolve unset parameters against configured defaults</li>
 *   <li>Wait (bounded) for the speech model to be ready</li>
 *   <li>Run the engine and build the result</li>
 *   <li>Delete the temp file, whatever happened above</li>
 * </ol>
 *
 * <p><b>Error Handling:</b> the first failure is propagated unchanged as one of
 * {@link com.phillippitts.transcribe.exception.UnsupportedFormatException},
 * {@link com.phillippitts.transcribe.exception.FileTooLargeException},
 * {@link com.phillippitts.transcribe.exception.StorageException},
 * {@link com.phillippitts.transcribe.exception.ModelUnavailableException} or
 * {@link com.phillippitts.transcribe.exception.InferenceException}. A failed temp-file
 * deletion is logged and counted but never replaces the result or the primary error.
 *
 * @since 1.0
 */
public interface TranscriptionOrchestrator {

    /**
     * Transcribes an uploaded audio stream.
     *
     * @param source upload body; read at most once, not closed
     * @param filename client-declared filename
     * @param params client parameters (unset fields use defaults)
     * @return the transcription result
     */
    TranscriptionResult handle(InputStream source, String filename, TranscriptionParams params);
}
