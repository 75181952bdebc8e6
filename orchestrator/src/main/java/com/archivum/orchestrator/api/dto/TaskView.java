package com.archivum.orchestrator.api.dto;

import com.archivum.orchestrator.model.Task;

import java.time.Instant;
import java.util.UUID;

/**
 * One Task as listed by GET /jobs/{jobId}/tasks. {@code fileId} is empty for
 * package-level tasks.
 */
public record TaskView(
        UUID    id,
        String  fileId,
        String  filename,
        int     exitCode,
        boolean launchFailure,
        String  execution,
        String  arguments,
        String  stdout,
        String  stderr,
        Instant startTime,
        Instant endTime
) {
    public static TaskView from(Task t) {
        return new TaskView(
                t.getId(),
                t.getFileId(),
                t.getFilename(),
                t.getExitCode(),
                t.isLaunchFailure(),
                t.getExecution(),
                t.getArguments(),
                t.getStdout(),
                t.getStderr(),
                t.getStartTime(),
                t.getEndTime()
        );
    }
}
