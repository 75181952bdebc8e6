package com.archivum.orchestrator.executor;

import java.time.Instant;

/**
 * What the executor reports for one task. Expected failures (nonzero exit,
 * missing input, tool that cannot be started) are all expressed here.
 */
public record TaskResult(
        int     exitCode,
        String  stdout,
        String  stderr,
        boolean launchFailure,
        Instant startTime,
        Instant endTime) {

    /** Exit code recorded when the tool could not be started at all. */
    public static final int LAUNCH_FAILURE_CODE = -1;

    public static TaskResult launchFailure(String reason, Instant startTime) {
        return new TaskResult(LAUNCH_FAILURE_CODE, "", reason, true, startTime, Instant.now());
    }

    public boolean success() {
        return exitCode == 0;
    }
}
