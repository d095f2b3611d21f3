package com.phillippitts.transcribe.presentation.controller;

import com.phillippitts.transcribe.config.stt.WhisperConfig;
import com.phillippitts.transcribe.config.stt.WhisperModelConstants;
import com.phillippitts.transcribe.presentation.dto.HealthResponse;
import com.phillippitts.transcribe.presentation.dto.ModelsResponse;
import com.phillippitts.transcribe.service.model.ModelLifecycleManager;
import com.phillippitts.transcribe.service.model.ModelStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated service metadata: health and the model catalogue.
 * Both endpoints answer 200 regardless of model state.
 */
@RestController
class ServiceInfoController {

    private final ModelLifecycleManager lifecycle;
    private final WhisperConfig whisper;
    private final String version;

    ServiceInfoController(ModelLifecycleManager lifecycle,
                          WhisperConfig whisper,
                          @Value("${info.app.version:1.0.0}") String version) {
        this.lifecycle = lifecycle;
        this.whisper = whisper;
        this.version = version;
    }

    @GetMapping("/health")
    ResponseEntity<HealthResponse> health() {
        ModelStatus status = lifecycle.getStatusSnapshot();
        return ResponseEntity.ok(new HealthResponse(
                status.engineLoaded() ? "healthy" : "degraded",
                status.state().name(),
                status.model(),
                status.device(),
                status.computeType(),
                version,
                status.failureMessage()
        ));
    }

    @GetMapping("/api/v1/models")
    ResponseEntity<ModelsResponse> models() {
        return ResponseEntity.ok(new ModelsResponse(WhisperModelConstants.AVAILABLE_MODELS, whisper.model()));
    }
}
