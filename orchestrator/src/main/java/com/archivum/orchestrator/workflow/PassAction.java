package com.archivum.orchestrator.workflow;

public record PassAction() implements LinkAction {

    @Override
    public ActionType type() { return ActionType.PASS; }
}
