/**
 * Speech engine abstraction.
 *
 * <p>{@link com.phillippitts.transcribe.service.stt.SpeechEngine} hides the concrete
 * recognizer behind a single call that returns a lazily produced segment sequence.
 * {@link com.phillippitts.transcribe.service.stt.SpeechEngineFactory} builds it once;
 * the lifecycle manager owns the result.
 *
 * @see com.phillippitts.transcribe.service.stt.whisper
 * @since 1.0
 */
package com.phillippitts.transcribe.service.stt;
