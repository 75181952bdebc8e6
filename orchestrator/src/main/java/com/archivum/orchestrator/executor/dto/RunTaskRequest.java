package com.archivum.orchestrator.executor.dto;

import java.util.List;

/**
 * Request body for POST /tasks/run on the executor service.
 */
public record RunTaskRequest(
        String       transfer_id,
        String       file_id,
        String       tool,
        List<String> arguments,
        String       working_directory,
        long         timeout_sec
) {}
