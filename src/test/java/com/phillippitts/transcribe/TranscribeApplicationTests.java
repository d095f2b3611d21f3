package com.phillippitts.transcribe;

import com.phillippitts.transcribe.service.model.LoadState;
import com.phillippitts.transcribe.service.model.ModelLifecycleManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "model.preload=false", // no whisper.cpp binary or model on test machines
        "security.api-keys=test-key"
    }
)
class TranscribeApplicationTests {

    @Autowired
    private ModelLifecycleManager lifecycle;

    @Test
    void contextLoadsWithoutTouchingTheModel() {
        assertThat(lifecycle.getStatusSnapshot().state()).isEqualTo(LoadState.UNINITIALIZED);
    }
}
