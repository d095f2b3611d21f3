/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.transcribe.exception.TranscribeException}
 * and are unchecked. Each kind maps to exactly one HTTP outcome in
 * {@code GlobalExceptionHandler}:
 * <ul>
 *   <li>{@link com.phillippitts.transcribe.exception.UnsupportedFormatException} - 400</li>
 *   <li>{@link com.phillippitts.transcribe.exception.InvalidParameterException} - 400</li>
 *   <li>{@link com.phillippitts.transcribe.exception.FileTooLargeException} - 413</li>
 *   <li>{@link com.phillippitts.transcribe.exception.ModelUnavailableException} - 503</li>
 *   <li>{@link com.phillippitts.transcribe.exception.StorageException} - 500</li>
 *   <li>{@link com.phillippitts.transcribe.exception.InferenceException} - 500</li>
 * </ul>
 *
 * <p>{@link com.phillippitts.transcribe.exception.ModelNotFoundException} never reaches a
 * client directly: it is raised while the engine is built and is surfaced to requests as a
 * {@code ModelUnavailableException} with reason {@code LOAD_FAILED}.
 *
 * @since 1.0
 */
package com.phillippitts.transcribe.exception;
