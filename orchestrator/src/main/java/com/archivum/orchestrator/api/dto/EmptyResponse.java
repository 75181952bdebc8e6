package com.archivum.orchestrator.api.dto;

public record EmptyResponse(int purged) {}
