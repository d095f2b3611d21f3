package com.phillippitts.transcribe.service.stt.util;

import com.phillippitts.transcribe.exception.ModelUnavailableException;
import com.phillippitts.transcribe.exception.ModelUnavailableException.Reason;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Guards engine invocations with a fair semaphore so that at most N run at once.
 *
 * <p>With one permit (the default) all inferences are serialized, which is required for
 * engines that are not proven reentrant.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. The underlying {@link Semaphore}
 * handles concurrent acquire/release operations safely.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * guard.acquire(); // Blocks until permit available or timeout
 * try {
 *     // ... perform transcription ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 *
 * @since 1.0
 */
public final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final Duration timeout;
    private final String engineName;

    /**
     * Constructs a guard over a fresh fair semaphore.
     *
     * @param permits maximum number of concurrent holders (at least 1)
     * @param timeout maximum time to wait for a permit
     * @param engineName engine name for error messages
     */
    public ConcurrencyGuard(int permits, Duration timeout, String engineName) {
        if (permits < 1) {
            throw new IllegalArgumentException("permits must be >= 1, got: " + permits);
        }
        this.semaphore = new Semaphore(permits, true);
        this.timeout = timeout;
        this.engineName = engineName;
    }

    /**
     * Acquires a permit, blocking up to the configured timeout.
     *
     * <p>Must be called outside the {@code try} whose {@code finally} releases the permit,
     * so a failed acquire never releases a permit it does not hold.
     *
     * @throws ModelUnavailableException with reason BUSY if no permit frees up in time,
     *         or INTERRUPTED if the waiting thread is interrupted
     */
    public void acquire() {
        try {
            boolean acquired = semaphore.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new ModelUnavailableException(Reason.BUSY,
                        engineName + " busy: no inference slot freed up within " + timeout.toSeconds() + "s",
                        timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelUnavailableException(Reason.INTERRUPTED,
                    engineName + " inference interrupted while waiting for a slot", null, e);
        }
    }

    /**
     * Releases a previously acquired permit.
     */
    public void release() {
        semaphore.release();
    }

    /**
     * Returns the number of available permits.
     */
    public int availablePermits() {
        return semaphore.availablePermits();
    }
}
