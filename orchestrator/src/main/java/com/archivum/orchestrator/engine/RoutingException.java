package com.archivum.orchestrator.engine;

/**
 * The graph cannot route a Job: unmapped exit code, missing decision option,
 * or a decision value with no choice. Always fatal to the package.
 */
public class RoutingException extends RuntimeException {

    public RoutingException(String linkId, String message) {
        super("Link '" + linkId + "': " + message);
    }
}
