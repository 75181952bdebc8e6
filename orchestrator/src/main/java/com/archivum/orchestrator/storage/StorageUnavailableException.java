package com.archivum.orchestrator.storage;

import com.archivum.orchestrator.executor.ExecutorException;

/**
 * The processing directory cannot be read or written. Treated like any other
 * infrastructure failure: the current Job is aborted without routing.
 */
public class StorageUnavailableException extends ExecutorException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
