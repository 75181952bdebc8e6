package com.archivum.orchestrator.api.dto;

import java.util.UUID;

public record SubmitTransferResponse(UUID id) {}
