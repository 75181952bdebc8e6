package com.archivum.orchestrator.executor;

/**
 * Runs one task and reports how it ended.
 *
 * Implementations never throw for a tool that fails or cannot be launched;
 * that is a {@link TaskResult} with a nonzero code. They throw
 * {@link ExecutorException} only when the infrastructure itself is broken.
 */
public interface TaskExecutor {

    TaskResult execute(TaskSpec spec);
}
