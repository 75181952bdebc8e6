package com.archivum.orchestrator.workflow;

public class UnknownLinkException extends WorkflowGraphException {

    private final String linkId;

    public UnknownLinkException(String linkId) {
        super("No link with id '" + linkId + "'");
        this.linkId = linkId;
    }

    public UnknownLinkException(String linkId, String referencedFrom) {
        super("Link '" + referencedFrom + "' references unknown link or chain '" + linkId + "'");
        this.linkId = linkId;
    }

    public String getLinkId() { return linkId; }
}
