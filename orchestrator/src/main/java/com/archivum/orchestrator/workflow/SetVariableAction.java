package com.archivum.orchestrator.workflow;

/** Stores {@code value} (a template) under {@code variable} for the package. */
public record SetVariableAction(String variable, String value) implements LinkAction {

    @Override
    public ActionType type() { return ActionType.SET_VARIABLE; }
}
