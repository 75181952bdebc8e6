package com.archivum.orchestrator.workflow;

import java.util.Collection;
import java.util.Map;

/**
 * The immutable, process-wide workflow definition.
 *
 * Built once by {@link WorkflowGraphLoader} at startup and shared read-only by
 * every package in flight. All references were validated during loading, so
 * {@link #resolve} only fails for ids that come from outside the graph
 * (e.g. a Job row written by an older graph version).
 */
public final class WorkflowGraph {

    private final int                version;
    private final String             entryChainId;
    private final Map<String, Chain> chains;
    private final Map<String, Link>  links;

    WorkflowGraph(int version, String entryChainId, Map<String, Chain> chains, Map<String, Link> links) {
        this.version      = version;
        this.entryChainId = entryChainId;
        this.chains       = Map.copyOf(chains);
        this.links        = Map.copyOf(links);
    }

    public Link resolve(String linkId) {
        Link link = links.get(linkId);
        if (link == null) {
            throw new UnknownLinkException(linkId);
        }
        return link;
    }

    public Chain entryChain() {
        return chains.get(entryChainId);
    }

    public Link entryLink() {
        return resolve(entryChain().firstLinkId());
    }

    public int version()                { return version; }
    public Collection<Link> links()     { return links.values(); }
    public Collection<Chain> chains()   { return chains.values(); }
}
