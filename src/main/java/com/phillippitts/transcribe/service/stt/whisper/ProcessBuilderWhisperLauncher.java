package com.phillippitts.transcribe.service.stt.whisper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Launches whisper-cli with {@link ProcessBuilder}, inside the audio directory.
 */
final class ProcessBuilderWhisperLauncher implements WhisperLauncher {

    private static final Logger LOG = LogManager.getLogger(ProcessBuilderWhisperLauncher.class);

    @Override
    public Process launch(List<String> command, Path audioDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(false);
        if (audioDir != null) {
            pb.directory(audioDir.toFile());
        }
        LOG.debug("Launching whisper-cli ({} args) in {}", command.size() - 1, audioDir);
        Process process = pb.start();
        // whisper-cli never reads stdin
        process.getOutputStream().close();
        return process;
    }
}
