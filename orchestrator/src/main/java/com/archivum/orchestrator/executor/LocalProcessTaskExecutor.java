package com.archivum.orchestrator.executor;

import com.archivum.orchestrator.config.ArchivumProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs tools as local subprocesses.
 *
 * The command line is the tool's registered base command followed by the
 * task's resolved arguments. stdout and stderr go to temporary files so a
 * chatty tool can never block on a full pipe.
 */
@Component
@ConditionalOnProperty(prefix = "archivum.executor", name = "mode", havingValue = "local", matchIfMissing = true)
public class LocalProcessTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessTaskExecutor.class);

    /** Exit code reported for a tool killed at its deadline (same as coreutils timeout). */
    static final int TIMEOUT_EXIT_CODE = 124;

    // Captured output is truncated to keep Task rows bounded.
    private static final int MAX_OUTPUT_CHARS = 64 * 1024;

    private final ToolRegistry tools;
    private final Duration     defaultTimeout;

    public LocalProcessTaskExecutor(ToolRegistry tools, ArchivumProperties properties) {
        this.tools          = tools;
        this.defaultTimeout = properties.executor().timeout();
        log.info("Local executor ready with tools {} (default timeout {})", tools.names(), defaultTimeout);
    }

    @Override
    public TaskResult execute(TaskSpec spec) {
        Instant start = Instant.now();

        List<String> base = tools.commandFor(spec.tool()).orElse(null);
        if (base == null || base.isEmpty()) {
            log.warn("Tool '{}' is not registered", spec.tool());
            return TaskResult.launchFailure("Tool '" + spec.tool() + "' is not registered", start);
        }
        if (!Files.isDirectory(spec.workingDirectory())) {
            throw new ExecutorException("Working directory " + spec.workingDirectory() + " is not available");
        }

        List<String> command = new ArrayList<>(base);
        command.addAll(spec.arguments());

        Path out;
        Path err;
        try {
            out = Files.createTempFile("archivum-task", ".out");
            err = Files.createTempFile("archivum-task", ".err");
        } catch (IOException e) {
            throw new ExecutorException("Cannot create output capture files", e);
        }

        try {
            Process process;
            try {
                process = new ProcessBuilder(command)
                        .directory(spec.workingDirectory().toFile())
                        .redirectOutput(out.toFile())
                        .redirectError(err.toFile())
                        .start();
            } catch (IOException e) {
                log.warn("Tool '{}' could not be launched: {}", spec.tool(), e.getMessage());
                return TaskResult.launchFailure("Cannot launch " + command.get(0) + ": " + e.getMessage(), start);
            }

            Duration timeout = spec.timeout() != null ? spec.timeout() : defaultTimeout;
            int exitCode;
            String timeoutNote = "";
            if (process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                exitCode = process.exitValue();
            } else {
                process.destroyForcibly().waitFor();
                exitCode = TIMEOUT_EXIT_CODE;
                timeoutNote = "\nKilled after " + timeout.toSeconds() + "s timeout";
                log.warn("Tool '{}' timed out after {}", spec.tool(), timeout);
            }

            return new TaskResult(exitCode, read(out), read(err) + timeoutNote,
                    false, start, Instant.now());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException("Interrupted while running " + spec.tool(), e);
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private static String read(Path file) {
        // A UTF-8 char is at most four bytes, so this prefix always decodes to the cap.
        try (InputStream in = Files.newInputStream(file)) {
            byte[] head = in.readNBytes(MAX_OUTPUT_CHARS * 4);
            // Tools print whatever bytes they like; decode leniently.
            String text = new String(head, StandardCharsets.UTF_8);
            return text.length() > MAX_OUTPUT_CHARS ? text.substring(0, MAX_OUTPUT_CHARS) : text;
        } catch (IOException e) {
            throw new ExecutorException("Cannot read captured output " + file, e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete capture file {}: {}", file, e.getMessage());
        }
    }
}
