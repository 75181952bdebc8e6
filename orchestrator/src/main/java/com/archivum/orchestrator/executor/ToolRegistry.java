package com.archivum.orchestrator.executor;

import com.archivum.orchestrator.config.ArchivumProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tool name to base command line, from {@code archivum.tools.*}.
 *
 * <pre>
 * archivum:
 *   tools:
 *     identify_format: [fido, -q]
 * </pre>
 */
@Component
public class ToolRegistry {

    private final Map<String, List<String>> commands;

    public ToolRegistry(ArchivumProperties properties) {
        this.commands = Map.copyOf(properties.tools());
    }

    public Optional<List<String>> commandFor(String tool) {
        return Optional.ofNullable(commands.get(tool));
    }

    public Set<String> names() {
        return commands.keySet();
    }
}
