package com.archivum.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code archivum.*} in application.yml.
 *
 * Each nested record maps one block of the YAML file; see the comments there
 * for what the individual settings do.
 */
@ConfigurationProperties(prefix = "archivum")
public record ArchivumProperties(
        @DefaultValue Workflow    workflow,
        @DefaultValue Storage     storage,
        @DefaultValue Engine      engine,
        @DefaultValue Executor    executor,
        Map<String, List<String>> tools,
        Processing                processing) {

    public ArchivumProperties {
        if (tools == null) tools = Map.of();
        if (processing == null) processing = new Processing(Map.of());
    }

    public record Workflow(
            @DefaultValue("classpath:workflow/workflow.json") String location) {}

    public record Storage(
            @DefaultValue("/tmp/archivum") Path processingDirectory) {}

    public record Engine(
            @DefaultValue("4")     int      concurrentPackages,
            @DefaultValue("8")     int      taskWorkers,
            @DefaultValue("2s")    Duration pollInterval,
            @DefaultValue("true")  boolean  schedulerEnabled) {}

    public record Executor(
            @DefaultValue("local") String   mode,
            String                          baseUrl,
            @DefaultValue("10m")   Duration timeout) {}

    public record Processing(Map<String, String> defaults) {

        public Processing {
            if (defaults == null) defaults = Map.of();
        }
    }
}
