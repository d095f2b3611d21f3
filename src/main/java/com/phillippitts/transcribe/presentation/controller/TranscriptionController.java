package com.phillippitts.transcribe.presentation.controller;

import com.phillippitts.transcribe.domain.TranscriptionParams;
import com.phillippitts.transcribe.domain.TranscriptionResult;
import com.phillippitts.transcribe.presentation.dto.TranscriptionResponse;
import com.phillippitts.transcribe.service.orchestration.TranscriptionOrchestrator;
import com.phillippitts.transcribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

/**
 * Transcription endpoint. Requires {@code X-API-Key} (enforced by
 * {@link com.phillippitts.transcribe.config.security.ApiKeyFilter}).
 */
@RestController
@RequestMapping("/api/v1")
class TranscriptionController {

    private static final Logger LOG = LogManager.getLogger(TranscriptionController.class);

    private final TranscriptionOrchestrator orchestrator;

    TranscriptionController(TranscriptionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(path = "/transcribe", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<TranscriptionResponse> transcribe(
            @RequestPart("file") MultipartFile file,
            @RequestParam(name = "language", required = false) String language,
            @RequestParam(name = "temperature", required = false) Double temperature,
            @RequestParam(name = "beam_size", required = false) Integer beamSize,
            @RequestParam(name = "initial_prompt", required = false) String initialPrompt,
            @RequestParam(name = "include_segments", defaultValue = "false") boolean includeSegments)
            throws IOException {

        LOG.info("Received transcription request: filename='{}', contentType={}, language={}",
                LogSanitizer.filename(file.getOriginalFilename()), file.getContentType(), language);

        TranscriptionParams params = new TranscriptionParams(language, temperature, beamSize, initialPrompt,
                includeSegments);
        TranscriptionResult result;
        try (InputStream in = file.getInputStream()) {
            result = orchestrator.handle(in, file.getOriginalFilename(), params);
        }
        return ResponseEntity.ok(TranscriptionResponse.from(result));
    }
}
