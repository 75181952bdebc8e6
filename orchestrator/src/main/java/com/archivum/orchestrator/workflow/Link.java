package com.archivum.orchestrator.workflow;

/**
 * One node of the workflow graph.
 *
 * @param id          stable identifier, referenced by routing entries and stored on every Job
 * @param chainId     chain this Link belongs to (nullable for links reached only by routing)
 * @param description human-readable name; becomes the Job name
 * @param group       display group label; becomes the Job group
 * @param action      what the Link does
 * @param routing     exit-code routing; unused by DECISION links
 */
public record Link(
        String       id,
        String       chainId,
        String       description,
        String       group,
        LinkAction   action,
        RoutingTable routing) {

    public ActionType actionType() {
        return action.type();
    }

    public boolean isDecision() {
        return action.type() == ActionType.DECISION;
    }
}
