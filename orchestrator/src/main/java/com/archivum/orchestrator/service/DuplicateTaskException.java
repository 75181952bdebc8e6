package com.archivum.orchestrator.service;

import java.util.UUID;

public class DuplicateTaskException extends RuntimeException {

    public DuplicateTaskException(UUID jobId, String fileId, Throwable cause) {
        super("Job " + jobId + " already has a task for file '" + fileId + "'", cause);
    }
}
