package com.archivum.orchestrator.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/** Builds {@link ArchivumProperties} for tests that run without Spring. */
public final class TestProperties {

    private TestProperties() {}

    public static ArchivumProperties withProcessingDirectory(Path root) {
        return create(root, Map.of(), Map.of(), Duration.ofSeconds(30));
    }

    public static ArchivumProperties withTools(Map<String, List<String>> tools, Duration timeout) {
        return create(Path.of("build", "archivum"), tools, Map.of(), timeout);
    }

    public static ArchivumProperties withDefaults(Map<String, String> defaults) {
        return create(Path.of("build", "archivum"), Map.of(), defaults, Duration.ofSeconds(30));
    }

    public static ArchivumProperties remote(String baseUrl, Duration timeout) {
        return new ArchivumProperties(
                new ArchivumProperties.Workflow("classpath:workflow/test-workflow.json"),
                new ArchivumProperties.Storage(Path.of("build", "archivum")),
                new ArchivumProperties.Engine(2, 4, Duration.ofMillis(100), false),
                new ArchivumProperties.Executor("remote", baseUrl, timeout),
                Map.of(),
                null);
    }

    private static ArchivumProperties create(Path root, Map<String, List<String>> tools,
                                             Map<String, String> defaults, Duration timeout) {
        return new ArchivumProperties(
                new ArchivumProperties.Workflow("classpath:workflow/test-workflow.json"),
                new ArchivumProperties.Storage(root),
                new ArchivumProperties.Engine(2, 4, Duration.ofMillis(100), false),
                new ArchivumProperties.Executor("local", null, timeout),
                tools,
                new ArchivumProperties.Processing(defaults));
    }
}
