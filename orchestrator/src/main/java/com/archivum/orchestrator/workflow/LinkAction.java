package com.archivum.orchestrator.workflow;

/**
 * What a Link does when the engine reaches it.
 *
 * One record per {@link ActionType}; the engine switches on {@link #type()}.
 */
public interface LinkAction {

    ActionType type();
}
