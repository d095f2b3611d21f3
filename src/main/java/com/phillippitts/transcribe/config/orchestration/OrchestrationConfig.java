package com.phillippitts.transcribe.config.orchestration;

import com.phillippitts.transcribe.config.properties.TranscriptionProperties;
import com.phillippitts.transcribe.service.metrics.TranscriptionMetrics;
import com.phillippitts.transcribe.service.model.ModelLifecycleManager;
import com.phillippitts.transcribe.service.orchestration.DefaultTranscriptionOrchestrator;
import com.phillippitts.transcribe.service.orchestration.TranscriptionOrchestrator;
import com.phillippitts.transcribe.service.transcription.ParameterResolver;
import com.phillippitts.transcribe.service.transcription.TranscriptionInvoker;
import com.phillippitts.transcribe.service.upload.UploadIngestionService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the request orchestrator explicitly so its collaborators stay visible in one place.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public TranscriptionOrchestrator transcriptionOrchestrator(UploadIngestionService ingestion,
                                                               ParameterResolver resolver,
                                                               ModelLifecycleManager lifecycle,
                                                               TranscriptionInvoker invoker,
                                                               TranscriptionProperties props,
                                                               TranscriptionMetrics metrics) {
        return new DefaultTranscriptionOrchestrator(ingestion, resolver, lifecycle, invoker, props, metrics);
    }
}
