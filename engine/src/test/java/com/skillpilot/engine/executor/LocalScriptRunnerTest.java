package com.skillpilot.engine.executor;

import com.skillpilot.engine.PackFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LocalScriptRunnerTest {

    @TempDir Path dir;

    @Test
    void command_interpreterChosenByExtension() {
        assertThat(LocalScriptRunner.command(dir.resolve("a.sh"))).first().isEqualTo("sh");
        assertThat(LocalScriptRunner.command(dir.resolve("a.py"))).first().isEqualTo("python3");
        assertThat(LocalScriptRunner.command(dir.resolve("a.mjs"))).first().isEqualTo("node");
        assertThat(LocalScriptRunner.command(dir.resolve("run"))).containsExactly(dir.resolve("run").toAbsolutePath().toString());
    }

    @Test
    void run_capturesStdoutStderrAndExitCode() {
        Path script = PackFixtures.write(dir.resolve("mixed.sh"), "echo out\necho err >&2\nexit 2\n");

        LocalScriptResult result = new LocalScriptRunner(Duration.ofSeconds(10)).run(script, Map.of());

        assertThat(result.exitCode()).isEqualTo(2);
        assertThat(result.stdout()).isEqualTo("out\n");
        assertThat(result.stderr()).isEqualTo("err\n");
        assertThat(result.succeeded()).isFalse();
    }

    @Test
    void run_runsInScriptDirectoryWithEnvironment() throws Exception {
        Path script = PackFixtures.write(dir.resolve("where.sh"), "pwd\necho \"$GREETING\"\n");

        LocalScriptResult result = new LocalScriptRunner(Duration.ofSeconds(10))
                .run(script, Map.of("GREETING", "hi there"));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.stdout()).endsWith("hi there\n");
        assertThat(Path.of(result.stdout().lines().findFirst().orElseThrow()).toRealPath().toString())
                .isEqualTo(dir.toRealPath().toString());
    }

    @Test
    void run_exceedingTimeout_killedAndFlagged() {
        Path script = PackFixtures.write(dir.resolve("slow.sh"), "exec sleep 5\n");

        LocalScriptResult result = new LocalScriptRunner(Duration.ofMillis(200)).run(script, Map.of());

        assertThat(result.timedOut()).isTrue();
        assertThat(result.exitCode()).isEqualTo(-1);
    }
}
