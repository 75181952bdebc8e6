package com.archivum.orchestrator.workflow;

import java.util.Objects;

/**
 * Destination of one routing entry: either another Link or a terminal outcome.
 *
 * Targets naming a chain are resolved to that chain's first Link when the graph
 * is loaded, so at traversal time only {@code linkId} matters.
 */
public record RouteTarget(Outcome outcome, String linkId) {

    public RouteTarget {
        Objects.requireNonNull(outcome, "outcome");
        if (outcome == Outcome.NEXT_LINK && (linkId == null || linkId.isBlank())) {
            throw new IllegalArgumentException("NEXT_LINK target requires a link id");
        }
        if (outcome.isTerminal() && linkId != null) {
            throw new IllegalArgumentException("Terminal target cannot name a link");
        }
    }

    public static RouteTarget link(String linkId) {
        return new RouteTarget(Outcome.NEXT_LINK, linkId);
    }

    public static RouteTarget terminal(Outcome outcome) {
        return new RouteTarget(outcome, null);
    }

    public boolean isTerminal() {
        return outcome.isTerminal();
    }

    @Override
    public String toString() {
        return isTerminal() ? outcome.name().toLowerCase() : "link:" + linkId;
    }
}
