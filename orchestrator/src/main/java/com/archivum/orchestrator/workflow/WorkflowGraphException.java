package com.archivum.orchestrator.workflow;

/**
 * Thrown when a workflow graph definition is invalid.
 *
 * Raised while the graph is loaded, so a broken definition stops the
 * application at startup instead of stranding a package mid-processing.
 */
public class WorkflowGraphException extends RuntimeException {

    public WorkflowGraphException(String message) {
        super(message);
    }

    public WorkflowGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
