package com.archivum.orchestrator.executor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * One fully resolved unit of work, ready to hand to a {@link TaskExecutor}.
 *
 * @param transferId       owning transfer, for logging only
 * @param fileId           file the task runs against ("" for the package)
 * @param tool             registered tool name
 * @param arguments        arguments with every template variable already replaced
 * @param workingDirectory directory the tool runs in
 * @param timeout          wall-clock limit; null means the executor default
 */
public record TaskSpec(
        UUID         transferId,
        String       fileId,
        String       tool,
        List<String> arguments,
        Path         workingDirectory,
        Duration     timeout) {

    public TaskSpec {
        arguments = List.copyOf(arguments);
    }

    /** Arguments as stored on the Task row. */
    public String argumentLine() {
        return String.join(" ", arguments);
    }
}
