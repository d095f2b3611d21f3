package com.phillippitts.transcribe.service.stt.whisper;

import com.phillippitts.transcribe.config.properties.TranscriptionProperties;
import com.phillippitts.transcribe.config.stt.WhisperConfig;
import com.phillippitts.transcribe.config.stt.WhisperModelConstants;
import com.phillippitts.transcribe.exception.ModelNotFoundException;
import com.phillippitts.transcribe.service.stt.SpeechEngine;
import com.phillippitts.transcribe.service.stt.SpeechEngineFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Builds the whisper.cpp engine after validating its model and binary.
 *
 * <p>Fail-fast: any missing or invalid file raises {@link ModelNotFoundException} with an
 * actionable message. The lifecycle manager records that message as the load failure.
 *
 * <p>Validation performed:
 * <ul>
 *   <li>model file exists, is a regular file and is at least 20MB</li>
 *   <li>binary exists, is a regular file and is executable</li>
 *   <li>VAD model exists when VAD filtering is on and one is configured</li>
 * </ul>
 */
@Component
public class WhisperCppEngineFactory implements SpeechEngineFactory {

    private static final Logger LOG = LogManager.getLogger(WhisperCppEngineFactory.class);

    private static final long BYTES_PER_MB = 1024 * 1024;

    private final WhisperConfig whisper;
    private final TranscriptionProperties transcription;
    private final WhisperLauncher launcher;

    @Autowired
    public WhisperCppEngineFactory(WhisperConfig whisper, TranscriptionProperties transcription) {
        this(whisper, transcription, new ProcessBuilderWhisperLauncher());
    }

    WhisperCppEngineFactory(WhisperConfig whisper, TranscriptionProperties transcription,
                            WhisperLauncher launcher) {
        this.whisper = whisper;
        this.transcription = transcription;
        this.launcher = launcher;
    }

    @Override
    public SpeechEngine create() {
        LOG.info("Loading whisper.cpp model: model='{}', device='{}', computeType='{}', os={}, arch={}",
                whisper.model(), whisper.device(), whisper.computeType(),
                System.getProperty("os.name"), System.getProperty("os.arch"));

        WhisperModelFiles files = validate();
        WhisperCppEngine engine = new WhisperCppEngine(new WhisperProcessManager(whisper, files, launcher));

        LOG.info("whisper.cpp engine ready: model='{}', binary='{}', vad={}",
                files.model(), files.binary(), files.vadAvailable());
        return engine;
    }

    // Visible for tests
    WhisperModelFiles validate() {
        Path model = resolvePath(modelPathString(), "Whisper model");
        Path binary = resolvePath(whisper.binaryPath(), "Whisper binary");

        validateModel(model);
        validateBinary(binary);
        Path vadModel = validateVadModel();

        return new WhisperModelFiles(binary, model, vadModel);
    }

    /**
     * Returns the configured model path, or {@code {models-dir}/ggml-{model}[-q8_0].bin}
     * when none is set explicitly.
     */
    String modelPathString() {
        if (whisper.hasExplicitModelPath()) {
            return whisper.modelPath();
        }
        String quantization = "int8".equalsIgnoreCase(whisper.computeType())
                ? WhisperModelConstants.INT8_SUFFIX : "";
        String fileName = "ggml-" + whisper.model().toLowerCase(Locale.ROOT) + quantization + ".bin";
        return Path.of(whisper.modelsDir(), fileName).toString();
    }

    private void validateModel(Path model) {
        if (!Files.exists(model)) {
            throw new ModelNotFoundException("Whisper model not found: " + model
                    + " (model='" + whisper.model() + "', computeType='" + whisper.computeType() + "')",
                    model.toString());
        }
        if (!Files.isRegularFile(model)) {
            throw new ModelNotFoundException("Whisper model is not a regular file: " + model, model.toString());
        }
        try {
            long sizeBytes = Files.size(model);
            if (sizeBytes < WhisperModelConstants.MIN_MODEL_SIZE_BYTES) {
                throw new ModelNotFoundException("Whisper model too small (" + sizeBytes + " bytes) at: " + model,
                        model.toString());
            }
            LOG.info("Whisper model size: {} MB (threshold: {} MB)", sizeBytes / BYTES_PER_MB,
                    WhisperModelConstants.MIN_MODEL_SIZE_BYTES / BYTES_PER_MB);
        } catch (IOException e) {
            throw new ModelNotFoundException("Failed to read Whisper model metadata at: " + model,
                    model.toString(), e);
        }
    }

    private void validateBinary(Path binary) {
        if (!Files.exists(binary)) {
            throw new ModelNotFoundException("Whisper binary not found: " + binary
                    + " (configured as: " + whisper.binaryPath() + ")", binary.toString());
        }
        if (!Files.isRegularFile(binary)) {
            throw new ModelNotFoundException("Whisper binary is not a regular file: " + binary, binary.toString());
        }
        if (!Files.isExecutable(binary)) {
            throw new ModelNotFoundException("Whisper binary not executable: " + binary
                    + " (try: chmod +x '" + binary + "')", binary.toString());
        }
    }

    private Path validateVadModel() {
        if (!transcription.vadFilter()) {
            return null;
        }
        if (!whisper.hasVadModel()) {
            LOG.warn("VAD filtering is enabled but stt.whisper.vad-model-path is not set; VAD will be skipped");
            return null;
        }
        Path vad = resolvePath(whisper.vadModelPath(), "VAD model");
        if (!Files.isRegularFile(vad)) {
            throw new ModelNotFoundException("VAD model not found: " + vad, vad.toString());
        }
        return vad;
    }

    /**
     * Resolves a configured path to an absolute one. Relative paths are resolved against
     * the working directory with a warning.
     */
    private static Path resolvePath(String pathString, String description) {
        Path path = Path.of(pathString);
        if (!path.isAbsolute()) {
            Path resolved = Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
            LOG.warn("{} uses relative path '{}' - resolved to '{}'. "
                    + "Consider using absolute paths in production to avoid ambiguity.",
                    description, pathString, resolved);
            return resolved;
        }
        return path;
    }
}
