package com.skillpilot.engine.executor;

import com.skillpilot.engine.skill.ErrorCode;
import com.skillpilot.engine.skill.SkillRunException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a local step script as a subprocess.
 *
 * The interpreter is chosen from the file extension ({@code .sh} → sh,
 * {@code .bash} → bash, {@code .py} → python3, {@code .js}/{@code .mjs} → node);
 * anything else is executed directly. Step inputs are exported as environment
 * variables on top of the inherited environment. The script runs with its
 * own directory as working directory.
 */
@Component
public class LocalScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(LocalScriptRunner.class);

    private final Duration timeout;

    public LocalScriptRunner(@Value("${skillpilot.local-step.timeout:5m}") Duration timeout) {
        this.timeout = timeout;
    }

    public LocalScriptResult run(Path script, Map<String, String> environment) {
        List<String> command = command(script);
        ProcessBuilder builder = new ProcessBuilder(command);
        Path workingDirectory = script.toAbsolutePath().getParent();
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        builder.redirectErrorStream(false);
        builder.environment().putAll(environment);

        log.info("Running local script {}", script);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new SkillRunException(ErrorCode.SKILL_RUN_LOCAL_FAILED,
                    "Failed to start " + String.join(" ", command) + ": " + e.getMessage(),
                    Map.of("script", script.toString()), e);
        }

        // Drain both pipes concurrently so a chatty script cannot fill one and block.
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));

        boolean finished;
        try {
            process.getOutputStream().close();
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new SkillRunException(ErrorCode.SKILL_RUN_LOCAL_FAILED,
                    "Interrupted while waiting for " + script, e);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new SkillRunException(ErrorCode.SKILL_RUN_LOCAL_FAILED,
                    "Failed to close stdin of " + script, e);
        }
        if (!finished) {
            log.warn("Local script {} exceeded {}; killing it", script, timeout);
            process.destroyForcibly();
        }

        int exitCode = finished ? process.exitValue() : -1;
        return new LocalScriptResult(exitCode, collect(stdout), collect(stderr), !finished);
    }

    static List<String> command(Path script) {
        String file = script.getFileName().toString().toLowerCase(Locale.ROOT);
        String path = script.toAbsolutePath().toString();
        List<String> command = new ArrayList<>();
        if (file.endsWith(".sh")) {
            command.add("sh");
        } else if (file.endsWith(".bash")) {
            command.add("bash");
        } else if (file.endsWith(".py")) {
            command.add("python3");
        } else if (file.endsWith(".js") || file.endsWith(".mjs")) {
            command.add("node");
        }
        command.add(path);
        return command;
    }

    private static String readAll(InputStream stream) {
        try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String collect(CompletableFuture<String> output) {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Could not collect script output: {}", e.getMessage());
            return "";
        }
    }
}
