/**
 * whisper.cpp speech engine implementation.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.transcribe.service.stt.whisper.WhisperCppEngineFactory} - Spring
 *       component that validates the model and binary and builds the engine</li>
 *   <li>{@link com.phillippitts.transcribe.service.stt.whisper.WhisperCppEngine} - the
 *       {@link com.phillippitts.transcribe.service.stt.SpeechEngine}</li>
 *   <li>{@link com.phillippitts.transcribe.service.stt.whisper.WhisperProcessManager} -
 *       process lifecycle (spawn, execute, timeout, cleanup)</li>
 *   <li>{@link com.phillippitts.transcribe.service.stt.whisper.WhisperJsonParser} - maps the
 *       {@code -oj} output to segments</li>
 *   <li>{@link com.phillippitts.transcribe.service.stt.whisper.WhisperLauncher} - seam that
 *       spawns whisper-cli (swapped out in tests)</li>
 * </ul>
 *
 * <p>Characteristics:
 * <ul>
 *   <li><b>Resource Model:</b> spawns one process per transcription; the model is reloaded
 *       by each process, so "loading" here means validating and wiring the files</li>
 *   <li><b>Input Format:</b> any container whisper.cpp reads (built with ffmpeg support for
 *       mp3/m4a/ogg/webm)</li>
 *   <li><b>Output Format:</b> JSON side file, deleted after parsing</li>
 *   <li><b>Timeout:</b> {@code stt.whisper.timeout-seconds} per process</li>
 * </ul>
 *
 * <p>Configuration (application.properties):
 * <pre>
 * stt.whisper.binary-path=/opt/whisper.cpp/build/bin/whisper-cli
 * stt.whisper.models-dir=/opt/whisper.cpp/models
 * stt.whisper.model=large
 * stt.whisper.compute-type=float16
 * stt.whisper.threads=4
 * </pre>
 *
 * @see com.phillippitts.transcribe.service.stt.SpeechEngine
 * @see com.phillippitts.transcribe.config.stt.WhisperConfig
 * @since 1.0
 */
package com.phillippitts.transcribe.service.stt.whisper;
