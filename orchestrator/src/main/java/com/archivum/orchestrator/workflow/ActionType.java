package com.archivum.orchestrator.workflow;

/**
 * The closed set of things a Link can do.
 *
 * RUN         : invoke a tool through the task executor, once for the package or once per file
 * SET_VARIABLE: store a package variable; no executor involved
 * DECISION    : pick the next Link from the processing configuration; no executor involved
 * PASS        : no-op; always exits 0
 */
public enum ActionType {
    RUN,
    SET_VARIABLE,
    DECISION,
    PASS;

    public static ActionType fromJson(String value) {
        return switch (value) {
            case "run"          -> RUN;
            case "set_variable" -> SET_VARIABLE;
            case "decision"     -> DECISION;
            case "pass"         -> PASS;
            default -> throw new WorkflowGraphException("Unknown action type '" + value + "'");
        };
    }
}
