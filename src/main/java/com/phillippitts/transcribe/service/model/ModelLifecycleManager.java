package com.phillippitts.transcribe.service.model;

import com.phillippitts.transcribe.config.stt.WhisperConfig;
import com.phillippitts.transcribe.exception.ModelUnavailableException;
import com.phillippitts.transcribe.exception.ModelUnavailableException.Reason;
import com.phillippitts.transcribe.service.stt.SpeechEngine;
import com.phillippitts.transcribe.service.stt.SpeechEngineFactory;
import com.phillippitts.transcribe.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the speech engine and drives it through
 * {@code UNINITIALIZED -> LOADING -> READY | FAILED}.
 *
 * <p>The first caller that observes {@code UNINITIALIZED} submits the load to the
 * {@code modelLoadExecutor}; every other caller waits on the same
 * {@link CompletableFuture}, which is the readiness signal. Completing the future
 * publishes the engine to all waiters with a happens-before edge. There is no reload:
 * READY and FAILED are terminal for the process lifetime.
 *
 * <p>{@link #getStatusSnapshot()} reads a volatile field and never blocks.
 */
@Service
public class ModelLifecycleManager {

    private static final Logger LOG = LogManager.getLogger(ModelLifecycleManager.class);

    private final SpeechEngineFactory engineFactory;
    private final TaskExecutor loadExecutor;
    private final CompletableFuture<SpeechEngine> ready = new CompletableFuture<>();
    private final AtomicInteger loadAttempts = new AtomicInteger();
    private final Object transitionLock = new Object();

    private volatile ModelStatus status;

    public ModelLifecycleManager(SpeechEngineFactory engineFactory,
                                 @Qualifier("modelLoadExecutor") TaskExecutor loadExecutor,
                                 WhisperConfig whisper) {
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
        this.loadExecutor = Objects.requireNonNull(loadExecutor, "loadExecutor");
        this.status = new ModelStatus(LoadState.UNINITIALIZED, false, null,
                whisper.model(), whisper.device(), whisper.computeType());
    }

    /**
     * Starts loading on the executor if nothing has started it yet. Calls made while
     * LOADING, READY or FAILED are no-ops. Never blocks on the load itself.
     */
    public void startLoadingAsync() {
        synchronized (transitionLock) {
            if (status.state() != LoadState.UNINITIALIZED) {
                return;
            }
            status = status.withState(LoadState.LOADING, false, null);
        }
        LOG.info("Model load scheduled: model='{}', device='{}', computeType='{}'",
                status.model(), status.device(), status.computeType());
        try {
            loadExecutor.execute(this::load);
        } catch (RejectedExecutionException e) {
            LOG.error("Model load could not be scheduled", e);
            fail("load executor rejected the task: " + e.getMessage(), e);
        }
    }

    /**
     * Blocks until the engine is READY, the load FAILED, or the timeout elapses.
     * Triggers the load if it has not started.
     *
     * @param timeout maximum time to wait
     * @return the loaded engine, borrowed for one transcription
     * @throws ModelUnavailableException LOAD_FAILED with the captured message, LOADING_TIMEOUT
     *         when the wait elapses, INTERRUPTED when the waiting thread is interrupted
     */
    public SpeechEngine waitUntilReady(Duration timeout) {
        startLoadingAsync();
        try {
            return ready.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Model still {} after waiting {} ms", status.state(), timeout.toMillis());
            throw ModelUnavailableException.loadingTimeout(timeout);
        } catch (ExecutionException e) {
            String recorded = status.failureMessage();
            throw ModelUnavailableException.loadFailed(
                    recorded != null ? recorded : failureMessageOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelUnavailableException(Reason.INTERRUPTED,
                    "Interrupted while waiting for the speech model", null, e);
        }
    }

    /**
     * Returns the current state without blocking.
     */
    public ModelStatus getStatusSnapshot() {
        return status;
    }

    /**
     * Number of engine construction attempts so far; never exceeds one.
     */
    int loadAttempts() {
        return loadAttempts.get();
    }

    private void load() {
        loadAttempts.incrementAndGet();
        long start = System.nanoTime();
        SpeechEngine engine;
        try {
            engine = engineFactory.create();
            if (engine == null) {
                throw new IllegalStateException("engine factory returned null");
            }
        } catch (RuntimeException | Error e) {
            LOG.error("Model load failed after {} ms: {}", TimeUtils.elapsedMillis(start), e.getMessage(), e);
            fail(failureMessageOf(e), e);
            if (e instanceof Error err) {
                throw err;
            }
            return;
        }
        synchronized (transitionLock) {
            status = status.withState(LoadState.READY, true, null);
        }
        ready.complete(engine);
        LOG.info("Model ready in {} ms (engine={})", TimeUtils.elapsedMillis(start), engine.getEngineName());
    }

    private void fail(String message, Throwable cause) {
        synchronized (transitionLock) {
            status = status.withState(LoadState.FAILED, false, message);
        }
        ready.completeExceptionally(cause);
    }

    private static String failureMessageOf(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getSimpleName() : msg;
    }

    /**
     * Closes the engine if it was loaded.
     */
    @PreDestroy
    public void shutdown() {
        if (!ready.isDone() || ready.isCompletedExceptionally()) {
            return;
        }
        SpeechEngine engine = ready.join();
        if (engine != null) {
            try {
                engine.close();
            } catch (RuntimeException e) {
                LOG.warn("Error closing speech engine: {}", e.toString());
            }
        }
    }
}
