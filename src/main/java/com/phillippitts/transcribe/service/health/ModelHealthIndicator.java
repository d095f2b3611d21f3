package com.phillippitts.transcribe.service.health;

import com.phillippitts.transcribe.service.model.ModelLifecycleManager;
import com.phillippitts.transcribe.service.model.ModelStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the speech model.
 *
 * <ul>
 *   <li>UP: model loaded</li>
 *   <li>DEGRADED: not loaded yet (uninitialized or loading)</li>
 *   <li>DOWN: load failed; needs operator action</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint as the {@code model} component.
 */
@Component
public class ModelHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final ModelLifecycleManager lifecycle;

    public ModelHealthIndicator(ModelLifecycleManager lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public Health health() {
        ModelStatus status = lifecycle.getStatusSnapshot();
        Health.Builder builder = new Health.Builder();

        switch (status.state()) {
            case READY -> builder.up()
                    .withDetail("status", "Model loaded");
            case FAILED -> builder.down()
                    .withDetail("status", "Model failed to load")
                    .withDetail("failure", status.failureMessage());
            default -> builder.status(DEGRADED)
                    .withDetail("status", "Model not loaded yet");
        }

        return builder
                .withDetail("state", status.state().name())
                .withDetail("model", status.model())
                .withDetail("device", status.device())
                .withDetail("computeType", status.computeType())
                .build();
    }
}
