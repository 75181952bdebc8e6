package com.archivum.orchestrator.executor;

/**
 * Infrastructure failure below the task boundary: working storage unavailable,
 * remote executor unreachable or answering with garbage.
 *
 * There is no exit code to route on, so the engine aborts the current Job.
 */
public class ExecutorException extends RuntimeException {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
