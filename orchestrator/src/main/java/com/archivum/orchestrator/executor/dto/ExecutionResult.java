package com.archivum.orchestrator.executor.dto;

/**
 * Response from POST /tasks/run.
 *
 * {@code launch_failure} is true when the service could not start the tool;
 * {@code exit_code} is then meaningless and the caller substitutes its sentinel.
 */
public record ExecutionResult(
        int     exit_code,
        String  stdout,
        String  stderr,
        double  elapsed_sec,
        boolean launch_failure
) {}
