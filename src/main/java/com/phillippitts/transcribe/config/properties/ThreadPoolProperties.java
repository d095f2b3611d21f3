package com.phillippitts.transcribe.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>The model-load pool always runs a single worker: the model is loaded at most once,
 * so only its naming is tuneable.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private ModelLoadPoolProperties modelLoad = new ModelLoadPoolProperties();

    public ModelLoadPoolProperties getModelLoad() {
        return modelLoad;
    }

    public void setModelLoad(ModelLoadPoolProperties modelLoad) {
        this.modelLoad = modelLoad;
    }

    /**
     * Model-load executor configuration.
     */
    public static class ModelLoadPoolProperties {
        private String threadNamePrefix = "model-load-";
        private int awaitTerminationSeconds = 5;

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }
    }
}
