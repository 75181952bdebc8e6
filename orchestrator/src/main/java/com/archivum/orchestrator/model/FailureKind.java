package com.archivum.orchestrator.model;

/**
 * Why a Job or Transfer failed.
 *
 * TOOL          : a tool exit code routed the package to fail/reject
 * CONFIGURATION : the workflow graph or processing configuration could not be applied
 * INFRASTRUCTURE: the executor or working storage was unavailable; no exit code existed
 */
public enum FailureKind {
    TOOL,
    CONFIGURATION,
    INFRASTRUCTURE
}
