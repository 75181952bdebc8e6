package com.archivum.orchestrator.processing;

/** A submitted or default processing configuration does not validate. */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
