package com.phillippitts.transcribe.service.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Kicks off the model load once the application is ready to serve, so startup is not
 * blocked and early requests wait on the readiness signal instead of failing.
 *
 * <p>Disabled with {@code model.preload=false}; the first request then triggers the load.
 */
@Component
@ConditionalOnProperty(name = "model.preload", havingValue = "true", matchIfMissing = true)
class ModelPreloader {

    private static final Logger LOG = LogManager.getLogger(ModelPreloader.class);

    private final ModelLifecycleManager lifecycle;

    ModelPreloader(ModelLifecycleManager lifecycle) {
        this.lifecycle = lifecycle;
    }

    @EventListener(ApplicationReadyEvent.class)
    void onApplicationReady() {
        LOG.info("Application ready; preloading speech model in background");
        lifecycle.startLoadingAsync();
    }
}
