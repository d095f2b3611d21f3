package com.phillippitts.transcribe.service.stt.whisper;

import com.phillippitts.transcribe.config.stt.WhisperConfig;
import com.phillippitts.transcribe.domain.EffectiveParams;
import com.phillippitts.transcribe.exception.InferenceException;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.transcribe.service.stt.whisper.WhisperTestDoubles.FailingLauncher;
import static com.phillippitts.transcribe.service.stt.whisper.WhisperTestDoubles.ProcessBehavior;
import static com.phillippitts.transcribe.service.stt.whisper.WhisperTestDoubles.StubLauncher;
import static com.phillippitts.transcribe.service.stt.whisper.WhisperTestDoubles.TestProcess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhisperProcessManagerHermeticTest {

    @TempDir
    Path tempDir;

    private Path audio;
    private WhisperModelFiles files;

    @BeforeEach
    void setUp() throws Exception {
        audio = Files.writeString(tempDir.resolve("audio_1234.mp3"), "fake audio");
        files = new WhisperModelFiles(Path.of("/opt/whisper/whisper-cli"), Path.of("/opt/whisper/ggml-large.bin"),
                null);
    }

    private static WhisperConfig config(String device, int timeoutSeconds) {
        return new WhisperConfig("/opt/whisper/whisper-cli", "/opt/whisper", "large", "", device, "float16",
                4, timeoutSeconds, 1048576, "");
    }

    private static EffectiveParams params(String prompt, boolean vad) {
        return new EffectiveParams("it", 0.2, 5, prompt, false, vad);
    }

    @Test
    void successReturnsJsonAndDeletesSideFile() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, 0));
        StubLauncher launcher = new StubLauncher(tp, WhisperTestDoubles.THREE_SEGMENTS_JSON);
        WhisperProcessManager mgr = new WhisperProcessManager(config("cuda", 5), files, launcher);

        String json = mgr.run(audio, params(null, false));

        assertThat(json).contains("\"transcription\"");
        Path sideFile = Path.of(WhisperProcessManager.outputBaseFor(audio.toAbsolutePath()) + ".json");
        assertThat(sideFile).doesNotExist();
        assertThat(audio).exists();
        assertThat(launcher.lastWorkingDir()).isEqualTo(audio.toAbsolutePath().getParent());
    }

    @Test
    void commandCarriesDecodingParameters() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, 0));
        StubLauncher launcher = new StubLauncher(tp, "{}");
        WhisperProcessManager mgr = new WhisperProcessManager(config("cuda", 5), files, launcher);

        mgr.run(audio, params("Medical vocabulary", false));

        List<String> cmd = launcher.lastCommand();
        assertThat(cmd.get(0)).isEqualTo("/opt/whisper/whisper-cli");
        assertThat(cmd).containsSequence("-m", "/opt/whisper/ggml-large.bin");
        assertThat(cmd).containsSequence("-f", audio.toAbsolutePath().toString());
        assertThat(cmd).containsSequence("-l", "it");
        assertThat(cmd).containsSequence("-t", "4");
        assertThat(cmd).containsSequence("-bs", "5");
        assertThat(cmd).containsSequence("-tp", "0.2");
        assertThat(cmd).containsSequence("--prompt", "Medical vocabulary");
        assertThat(cmd).contains("-np", "-oj");
        assertThat(cmd).doesNotContain("-ng", "--vad");
    }

    @Test
    void cpuDeviceDisablesGpuAndVadNeedsModel() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, 0));
        StubLauncher launcher = new StubLauncher(tp, "{}");
        WhisperModelFiles withVad = new WhisperModelFiles(files.binary(), files.model(),
                Path.of("/opt/whisper/silero.bin"));
        WhisperProcessManager mgr = new WhisperProcessManager(config("cpu", 5), withVad, launcher);

        mgr.run(audio, params(null, true));

        assertThat(launcher.lastCommand()).contains("-ng");
        assertThat(launcher.lastCommand()).containsSequence("--vad", "-vm", "/opt/whisper/silero.bin");
        assertThat(launcher.lastCommand()).doesNotContain("--prompt");
    }

    @Test
    void vadToggleIgnoredWithoutVadModel() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, 0));
        StubLauncher launcher = new StubLauncher(tp, "{}");
        WhisperProcessManager mgr = new WhisperProcessManager(config("cuda", 5), files, launcher);

        mgr.run(audio, params(null, true));

        assertThat(launcher.lastCommand()).doesNotContain("--vad");
    }

    @Test
    void nonZeroExitThrowsWithStderrSnippet() {
        TestProcess tp = TestProcess.exitingWith(1, "failed to load model");
        StubLauncher launcher = new StubLauncher(tp, null);
        WhisperProcessManager mgr = new WhisperProcessManager(config("cuda", 5), files, launcher);

        assertThatThrownBy(() -> mgr.run(audio, params(null, false)))
                .isInstanceOf(InferenceException.class)
                .hasMessageContaining("Non-zero exit: 1")
                .hasMessageContaining("stderr=failed to load model")
                .hasMessageContaining("engine: whisper.cpp")
                .satisfies(e -> assertThat(((InferenceException) e).getReason()).isEqualTo("Non-zero exit: 1"));
    }

    @Test
    void missingJsonOutputThrows() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, 0));
        StubLauncher launcher = new StubLauncher(tp, null);
        WhisperProcessManager mgr = new WhisperProcessManager(config("cuda", 5), files, launcher);

        assertThatThrownBy(() -> mgr.run(audio, params(null, false)))
                .isInstanceOf(InferenceException.class)
                .hasMessageContaining("No JSON output produced");
    }

    @Test
    void launchFailureKeepsBinaryPathOutOfReason() {
        WhisperProcessManager mgr = new WhisperProcessManager(config("cuda", 5), files, new FailingLauncher());

        assertThatThrownBy(() -> mgr.run(audio, params(null, false)))
                .isInstanceOfSatisfying(InferenceException.class, e -> {
                    assertThat(e.getReason()).isEqualTo("Failed to run whisper.cpp");
                    assertThat(e.getMessage()).contains("Cannot run program \"/opt/whisper/whisper-cli\"");
                    assertThat(e.getCause()).isInstanceOf(java.io.IOException.class);
                });
    }

    @Test
    void timeoutKillsProcessAndThrows() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, -1 /*never finish*/));
        StubLauncher launcher = new StubLauncher(tp, null);
        WhisperProcessManager mgr = new WhisperProcessManager(config("cuda", 1), files, launcher);

        long start = System.nanoTime();
        assertThatThrownBy(() -> mgr.run(audio, params(null, false)))
                .isInstanceOf(InferenceException.class)
                .hasMessageContaining("Timeout after 1s");
        long durationMs = (System.nanoTime() - start) / 1_000_000L;
        assertThat(durationMs).isLessThan(5000);

        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(tp::wasDestroyCalled);
    }
}
