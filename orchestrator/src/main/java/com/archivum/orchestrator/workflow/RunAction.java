package com.archivum.orchestrator.workflow;

import java.util.List;

/**
 * Runs a registered tool.
 *
 * @param tool           name in the tool registry
 * @param arguments      argument templates, expanded per task
 * @param perFile        one task per file in the workspace instead of one for the package
 * @param filterSubdir   restricts per-file enumeration to this workspace subdirectory (nullable)
 * @param unanimous      when true the first non-zero task code (lowest file id) decides the route;
 *                       when false the job always routes on 0
 * @param timeoutSeconds wall-clock limit per task; 0 means the executor default
 */
public record RunAction(
        String       tool,
        List<String> arguments,
        boolean      perFile,
        String       filterSubdir,
        boolean      unanimous,
        int          timeoutSeconds) implements LinkAction {

    public RunAction {
        arguments = List.copyOf(arguments);
    }

    @Override
    public ActionType type() { return ActionType.RUN; }
}
