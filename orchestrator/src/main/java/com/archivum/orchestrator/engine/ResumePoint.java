package com.archivum.orchestrator.engine;

import com.archivum.orchestrator.model.Job;
import com.archivum.orchestrator.workflow.Link;
import com.archivum.orchestrator.workflow.Outcome;
import com.archivum.orchestrator.workflow.WorkflowGraph;

/**
 * Where the engine picks a package up, derived from its last persisted Job.
 *
 * <ul>
 *   <li>no Job yet: the entry link</li>
 *   <li>last Job still PROCESSING: that Job again, skipping tasks it already recorded</li>
 *   <li>last Job routed to another link: that link, with the Job's link as origin</li>
 * </ul>
 * A last Job with a terminal outcome has no resume point; the caller finishes
 * the transfer from it instead.
 *
 * @param link         link to run next
 * @param originLinkId link that routed here (null at the entry link)
 * @param inFlight     Job to reuse instead of starting a new one (nullable)
 */
record ResumePoint(Link link, String originLinkId, Job inFlight) {

    static ResumePoint start(WorkflowGraph graph) {
        return new ResumePoint(graph.entryLink(), null, null);
    }

    static ResumePoint from(Job last, WorkflowGraph graph) {
        if (!last.isFinished()) {
            return new ResumePoint(graph.resolve(last.getLinkId()), last.getOriginLinkId(), last);
        }
        if (last.getOutcome() == Outcome.NEXT_LINK) {
            return new ResumePoint(graph.resolve(last.getNextLinkId()), last.getLinkId(), null);
        }
        throw new IllegalArgumentException("Job " + last.getId() + " ended the transfer (" + last.getOutcome() + ")");
    }
}
