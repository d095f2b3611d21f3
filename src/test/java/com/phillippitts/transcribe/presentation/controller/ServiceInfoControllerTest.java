package com.phillippitts.transcribe.presentation.controller;

import com.phillippitts.transcribe.config.stt.WhisperConfig;
import com.phillippitts.transcribe.presentation.dto.HealthResponse;
import com.phillippitts.transcribe.presentation.dto.ModelsResponse;
import com.phillippitts.transcribe.service.model.LoadState;
import com.phillippitts.transcribe.service.model.ModelLifecycleManager;
import com.phillippitts.transcribe.service.model.ModelStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ServiceInfoControllerTest {

    private ModelLifecycleManager lifecycle;
    private ServiceInfoController controller;

    @BeforeEach
    void setUp() {
        lifecycle = mock(ModelLifecycleManager.class);
        controller = new ServiceInfoController(lifecycle, WhisperConfig.defaults(), "1.0.0");
    }

    @Test
    void healthyWhenModelLoaded() {
        when(lifecycle.getStatusSnapshot())
                .thenReturn(new ModelStatus(LoadState.READY, true, null, "large", "cuda", "float16"));

        HealthResponse body = controller.health().getBody();

        assertThat(body.status()).isEqualTo("healthy");
        assertThat(body.modelState()).isEqualTo("READY");
        assertThat(body.version()).isEqualTo("1.0.0");
        assertThat(body.failure()).isNull();
    }

    @Test
    void degradedButStill200WhileLoadingOrFailed() {
        when(lifecycle.getStatusSnapshot())
                .thenReturn(new ModelStatus(LoadState.FAILED, false, "model missing", "large", "cpu", "int8"));

        var response = controller.health();

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody().status()).isEqualTo("degraded");
        assertThat(response.getBody().failure()).isEqualTo("model missing");
        assertThat(response.getBody().device()).isEqualTo("cpu");
    }

    @Test
    void listsModelsWithActiveOne() {
        ModelsResponse body = controller.models().getBody();

        assertThat(body.models()).containsExactly("tiny", "base", "small", "medium", "large");
        assertThat(body.active()).isEqualTo("large");
    }
}
