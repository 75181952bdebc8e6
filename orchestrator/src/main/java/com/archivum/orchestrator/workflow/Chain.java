package com.archivum.orchestrator.workflow;

import java.util.List;

/** Named, ordered sequence of Link ids. The first Link is where the chain starts. */
public record Chain(String id, String description, List<String> linkIds) {

    public Chain {
        linkIds = List.copyOf(linkIds);
        if (linkIds.isEmpty()) {
            throw new WorkflowGraphException("Chain '" + id + "' has no links");
        }
    }

    public String firstLinkId() {
        return linkIds.get(0);
    }
}
