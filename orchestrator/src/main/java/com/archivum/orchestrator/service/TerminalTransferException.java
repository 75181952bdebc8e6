package com.archivum.orchestrator.service;

import com.archivum.orchestrator.model.PackageStatus;

import java.util.UUID;

/**
 * Thrown when something tries to start a Job for a Transfer that has already
 * reached COMPLETE, FAILED or REJECTED.
 */
public class TerminalTransferException extends RuntimeException {

    public TerminalTransferException(UUID transferId, PackageStatus status) {
        super("Transfer " + transferId + " is " + status + "; no further jobs may start");
    }
}
