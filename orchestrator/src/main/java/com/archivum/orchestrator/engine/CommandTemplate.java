package com.archivum.orchestrator.engine;

import com.archivum.orchestrator.model.Transfer;
import com.archivum.orchestrator.processing.ProcessingConfiguration;
import com.archivum.orchestrator.storage.WorkspaceManager;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Expands {@code %name%} placeholders in link arguments.
 *
 * <pre>
 *   %transferId% %transferName% %transferDirectory% %objectsDirectory% %logsDirectory%
 *   %fileId% %inputFile% %relativeLocation% %fileName% %fileExtension% %fileDirectory%
 *   %taskOutputDirectory% %config:&lt;option&gt;%  and every package variable as %name%
 * </pre>
 *
 * Unknown placeholders are left as they are.
 */
public final class CommandTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("%([A-Za-z_][A-Za-z0-9_]*(?::[A-Za-z0-9_]+)?)%");

    private CommandTemplate() {}

    public static String expand(String template, Map<String, String> variables) {
        if (template == null || template.indexOf('%') < 0) {
            return template;
        }
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = variables.get(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public static List<String> expandAll(List<String> templates, Map<String, String> variables) {
        return templates.stream().map(t -> expand(t, variables)).collect(Collectors.toList());
    }

    /** Variables shared by every task of a package. Built-ins win over package variables. */
    public static Map<String, String> packageVariables(Transfer transfer, Path workspace,
                                                      ProcessingConfiguration config,
                                                      Map<String, String> transferVariables) {
        Map<String, String> vars = new HashMap<>(transferVariables);
        config.options().forEach((key, value) -> vars.put("config:" + key, value));
        vars.put("transferId",        transfer.getId().toString());
        vars.put("transferName",      transfer.getName());
        vars.put("transferDirectory", workspace.toString());
        vars.put("objectsDirectory",  workspace.resolve(WorkspaceManager.OBJECTS_DIR).toString());
        vars.put("logsDirectory",     workspace.resolve(WorkspaceManager.LOGS_DIR).toString());
        return vars;
    }

    /** Package variables plus the ones describing a single task. */
    public static Map<String, String> taskVariables(Map<String, String> packageVariables, Path workspace,
                                                   WorkUnit unit, Path taskOutputDirectory) {
        Map<String, String> vars = new HashMap<>(packageVariables);
        vars.put("fileId",              unit.fileId());
        vars.put("taskOutputDirectory", taskOutputDirectory.toString());
        if (unit.isPackage()) {
            return vars;
        }
        Path input = workspace.resolve(unit.relativePath());
        String baseName = input.getFileName().toString();
        int dot = baseName.lastIndexOf('.');
        vars.put("inputFile",        input.toString());
        vars.put("relativeLocation", unit.relativePath());
        vars.put("fileName",         dot > 0 ? baseName.substring(0, dot) : baseName);
        vars.put("fileExtension",    dot > 0 ? baseName.substring(dot + 1) : "");
        vars.put("fileDirectory",    input.getParent().toString());
        return vars;
    }
}
