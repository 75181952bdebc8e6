package com.archivum.orchestrator.config;

import com.archivum.orchestrator.workflow.WorkflowGraph;
import com.archivum.orchestrator.workflow.WorkflowGraphLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads the workflow graph once at startup. An invalid graph fails the
 * application context, so a broken deployment never accepts a package.
 */
@Configuration
public class EngineConfig {

    @Bean
    public WorkflowGraphLoader workflowGraphLoader(ObjectMapper objectMapper) {
        return new WorkflowGraphLoader(objectMapper);
    }

    @Bean
    public WorkflowGraph workflowGraph(WorkflowGraphLoader loader,
                                       ResourceLoader resourceLoader,
                                       ArchivumProperties properties) {
        return loader.load(resourceLoader.getResource(properties.workflow().location()));
    }
}
