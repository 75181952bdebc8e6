package com.archivum.orchestrator.model;

/**
 * Execution state of one Job.
 *
 * Transitions:
 *   PROCESSING → COMPLETE (routed onward or to "complete")
 *   PROCESSING → FAILED   (routed to "fail"/"reject", or aborted by a configuration
 *                          or infrastructure error)
 */
public enum JobStatus {
    PROCESSING,
    COMPLETE,
    FAILED
}
