/**
 * Request orchestration.
 *
 * <p>{@link com.phillippitts.transcribe.service.orchestration.TranscriptionOrchestrator} sequences
 * validation, ingestion, parameter resolution, model readiness, inference and cleanup. It
 * owns the rule that no temp file outlives the request that created it.
 *
 * <p>The implementation is wired in
 * {@link com.phillippitts.transcribe.config.orchestration.OrchestrationConfig}.
 *
 * @since 1.0
 */
package com.phillippitts.transcribe.service.orchestration;
