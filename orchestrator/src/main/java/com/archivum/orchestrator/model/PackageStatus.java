package com.archivum.orchestrator.model;

import com.archivum.orchestrator.workflow.Outcome;

/**
 * Lifecycle of a Transfer.
 *
 * Transitions:
 *   PROCESSING → COMPLETE | FAILED | REJECTED
 *
 * Terminal states are final: no Job may start for the Transfer afterwards,
 * and the status is written exactly once.
 */
public enum PackageStatus {
    PROCESSING,
    COMPLETE,
    FAILED,
    REJECTED;

    public boolean isTerminal() {
        return this != PROCESSING;
    }

    /** Package status a terminal routing outcome leads to. */
    public static PackageStatus of(Outcome outcome) {
        return switch (outcome) {
            case COMPLETE  -> COMPLETE;
            case REJECT    -> REJECTED;
            case FAIL      -> FAILED;
            case NEXT_LINK -> throw new IllegalArgumentException("NEXT_LINK is not terminal");
        };
    }
}
