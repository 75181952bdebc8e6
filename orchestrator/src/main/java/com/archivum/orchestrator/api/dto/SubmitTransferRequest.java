package com.archivum.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /transfers.
 *
 * Required: name, url (file: URL or local path)
 * Optional: config, processing options keyed by name; anything omitted takes
 *   the deployment default.
 */
public record SubmitTransferRequest(String name, String url, Map<String, Object> config) {}
