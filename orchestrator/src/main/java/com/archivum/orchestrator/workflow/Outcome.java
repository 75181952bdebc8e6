package com.archivum.orchestrator.workflow;

/**
 * What a routing entry resolves to.
 *
 * NEXT_LINK continues processing; the other three end the package.
 */
public enum Outcome {
    NEXT_LINK,
    COMPLETE,
    FAIL,
    REJECT;

    public boolean isTerminal() {
        return this != NEXT_LINK;
    }

    /** Parses the "outcome" value used in the workflow JSON. */
    public static Outcome fromTerminalName(String name) {
        return switch (name.toLowerCase()) {
            case "complete" -> COMPLETE;
            case "fail"     -> FAIL;
            case "reject"   -> REJECT;
            default -> throw new WorkflowGraphException("Unknown outcome '" + name + "'");
        };
    }
}
