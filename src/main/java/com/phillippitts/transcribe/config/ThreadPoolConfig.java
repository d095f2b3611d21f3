package com.phillippitts.transcribe.config;

import com.phillippitts.transcribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for background executors.
 *
 * <p>Request handling runs on the servlet container's threads; the only background work is
 * loading the speech model, which happens at most once.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Single-thread executor for the model load.
     *
     * <ul>
     *   <li>Core pool = max pool = 1: only one load can ever run</li>
     *   <li>Queue: 1 task, the load itself</li>
     *   <li>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}; the lifecycle manager
     *       turns a rejection into a FAILED state</li>
     * </ul>
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext of the thread that triggered the
     * load, so a load started by a request logs with that request's id.
     *
     * @return executor used by {@link com.phillippitts.transcribe.service.model.ModelLifecycleManager}
     */
    @Bean(name = "modelLoadExecutor")
    public ThreadPoolTaskExecutor modelLoadExecutor() {
        ThreadPoolProperties.ModelLoadPoolProperties props = threadPoolProperties.getModelLoad();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext into the worker for the duration of the task.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
