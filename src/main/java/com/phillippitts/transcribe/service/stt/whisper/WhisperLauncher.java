package com.phillippitts.transcribe.service.stt.whisper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Spawns one whisper-cli process for {@link WhisperProcessManager}.
 *
 * <p>The manager owns the command line, the gobblers and the timeout; a launcher only turns
 * a command into a running {@link Process}. Tests swap in launchers that return scripted
 * processes and write the JSON side file themselves.
 */
interface WhisperLauncher {

    /**
     * @param command whisper-cli command line, binary first
     * @param audioDir directory holding the staged audio; whisper-cli writes its side file there
     * @throws IOException when the binary cannot be executed
     */
    Process launch(List<String> command, Path audioDir) throws IOException;
}
