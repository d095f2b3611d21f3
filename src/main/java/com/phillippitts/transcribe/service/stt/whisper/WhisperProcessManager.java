package com.phillippitts.transcribe.service.stt.whisper;

import com.phillippitts.transcribe.config.stt.WhisperConfig;
import com.phillippitts.transcribe.domain.EffectiveParams;
import com.phillippitts.transcribe.exception.InferenceException;
import com.phillippitts.transcribe.exception.InferenceExceptionBuilder;
import com.phillippitts.transcribe.util.ProcessTimeouts;
import com.phillippitts.transcribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Manages execution of the external whisper.cpp process for one transcription.
 *
 * <p>Responsibilities:
 * - Build a deterministic CLI from {@link WhisperConfig}, the validated model files and the request parameters
 * - Start the process via {@link WhisperLauncher}
 * - Capture stdout and stderr concurrently with capped gobblers
 * - Enforce a timeout and terminate runaway processes
 * - Read and delete the JSON side file written next to the audio
 * - Provide structured error context in {@link InferenceException}
 *
 * <p>All process state is local to a call, so one manager may serve concurrent
 * invocations when the caller allows them.
 */
final class WhisperProcessManager {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessManager.class);

    private final WhisperConfig cfg;
    private final WhisperModelFiles files;
    private final WhisperLauncher launcher;

    /**
     * Context for creating detailed error messages.
     */
    private record ErrorContext(
            int exitCode,
            StringBuilder stderr,
            long startNano,
            Throwable cause
    ) {}

    /**
     * Holds process execution state including process reference and stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    WhisperProcessManager(WhisperConfig cfg, WhisperModelFiles files, WhisperLauncher launcher) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.files = Objects.requireNonNull(files, "files");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
    }

    /**
     * Runs whisper.cpp on the given audio file and returns the JSON document it wrote.
     *
     * <p>CLI contract:
     * <pre>
     * ${binary} -m ${model} -f ${audio} -l ${language} -t ${threads} -bs ${beam} -tp ${temperature}
     *           [--prompt ${prompt}] [--vad -vm ${vadModel}] [-ng] -np -oj -of ${audio}.whisper
     * </pre>
     *
     * @param audioFile uploaded audio file
     * @param params resolved decoding parameters
     * @return content of {@code ${audio}.whisper.json}
     * @throws InferenceException on timeout, non-zero exit, missing output or I/O error
     */
    String run(Path audioFile, EffectiveParams params) {
        Objects.requireNonNull(audioFile, "audioFile");
        Objects.requireNonNull(params, "params");

        Path audio = audioFile.toAbsolutePath();
        Path outputBase = outputBaseFor(audio);
        Path jsonFile = Path.of(outputBase + WhisperConstants.JSON_SUFFIX);
        List<String> command = buildCommand(audio, outputBase, params);
        long startTime = System.nanoTime();
        ProcessExecution exec = null;

        try {
            exec = startProcessWithGobblers(command, audio.getParent());
            waitForProcessCompletion(exec, startTime);
            checkExitCode(exec, startTime);
            return readJson(jsonFile, exec, startTime);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            StringBuilder stderr = exec == null ? null : exec.stderr();
            String reason = e instanceof InterruptedException
                    ? "Interrupted while running whisper.cpp"
                    : "Failed to run whisper.cpp";
            throw whisperError(reason, new ErrorContext(-1, stderr, startTime, e));
        } finally {
            cleanup(exec);
            deleteQuietly(jsonFile);
        }
    }

    static Path outputBaseFor(Path audio) {
        return audio.resolveSibling(audio.getFileName() + WhisperConstants.OUTPUT_BASE_SUFFIX);
    }

    List<String> buildCommand(Path audio, Path outputBase, EffectiveParams params) {
        List<String> cmd = new ArrayList<>();
        cmd.add(files.binary().toString());

        cmd.add("-m");
        cmd.add(files.model().toString());

        cmd.add("-f");
        cmd.add(audio.toString());

        cmd.add("-l");
        cmd.add(params.language());

        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));

        cmd.add("-bs");
        cmd.add(String.valueOf(params.beamSize()));

        cmd.add("-tp");
        cmd.add(String.valueOf(params.temperature()));

        if (params.hasInitialPrompt()) {
            cmd.add("--prompt");
            cmd.add(params.initialPrompt());
        }

        if (params.vadFilter() && files.vadAvailable()) {
            cmd.add("--vad");
            cmd.add("-vm");
            cmd.add(files.vadModel().toString());
        }

        if (cfg.cpuOnly()) {
            cmd.add("-ng");
        }

        // No progress prints; JSON side file at ${outputBase}.json
        cmd.add("-np");
        cmd.add("-oj");
        cmd.add("-of");
        cmd.add(outputBase.toString());

        return cmd;
    }

    private ProcessExecution startProcessWithGobblers(List<String> command, Path workingDir) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process whisperProcess = launcher.launch(command, workingDir);

        // Start gobblers before waiting to avoid deadlock
        Thread outGobbler = startGobbler(whisperProcess.getInputStream(), stdout, "whisper-out",
                cfg.maxStdoutBytes());
        Thread errGobbler = startGobbler(whisperProcess.getErrorStream(), stderr, "whisper-err",
                WhisperConstants.STDERR_MAX_BYTES);

        return new ProcessExecution(whisperProcess, outGobbler, errGobbler, stdout, stderr);
    }

    private void waitForProcessCompletion(ProcessExecution exec, long startTime) throws InterruptedException {
        boolean finished = exec.process().waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
        if (!finished) {
            destroyProcess(exec.process());
            throw whisperError("Timeout after " + cfg.timeoutSeconds() + "s",
                    new ErrorContext(-1, exec.stderr(), startTime, null));
        }

        // Ensure gobblers have a moment to flush
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private void checkExitCode(ProcessExecution exec, long startTime) {
        int exitCode = exec.process().exitValue();
        if (exitCode != 0) {
            throw whisperError("Non-zero exit: " + exitCode,
                    new ErrorContext(exitCode, exec.stderr(), startTime, null));
        }
        LOG.debug("whisper.cpp exited cleanly in {} ms (stdout={} chars, stderr={} chars)",
                TimeUtils.elapsedMillis(startTime), exec.stdout().length(), exec.stderr().length());
    }

    private String readJson(Path jsonFile, ProcessExecution exec, long startTime) throws IOException {
        try {
            return Files.readString(jsonFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw whisperError("No JSON output produced", new ErrorContext(0, exec.stderr(), startTime, e));
        }
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, sink, name, maxBytes);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines from an input stream into a StringBuilder until capacity is reached.
     * Once the cap is hit, keeps draining the stream without accumulating so the
     * child process never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, available);
                            LOG.warn("Stream '{}' reached {}B cap (truncated line)", name, maxBytes);
                            capReached = true;
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }

    private void cleanup(ProcessExecution exec) {
        if (exec == null) {
            return;
        }
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete whisper.cpp output {}: {}", file, e.toString());
        }
    }

    private InferenceException whisperError(String msg, ErrorContext ctx) {
        long durationMs = TimeUtils.elapsedMillis(ctx.startNano());
        String stderrSnippet = ctx.stderr() == null ? "" : snippet(ctx.stderr(), WhisperConstants.ERROR_SNIPPET_MAX_CHARS);

        InferenceExceptionBuilder builder = InferenceExceptionBuilder.create(msg)
                .engine(WhisperConstants.ENGINE_NAME)
                .exitCode(ctx.exitCode())
                .durationMs(durationMs)
                .metadata("binaryPath", files.binary())
                .metadata("modelPath", files.model())
                .metadata("stderr", stderrSnippet);

        // The cause text may name local paths, so it stays out of the reason.
        if (ctx.cause() != null) {
            builder.cause(ctx.cause()).metadata("error", ctx.cause().getMessage());
        }

        return builder.build();
    }

    private static String snippet(StringBuilder sb, int maxChars) {
        synchronized (sb) {
            int len = Math.min(maxChars, sb.length());
            return sb.substring(0, len);
        }
    }
}
