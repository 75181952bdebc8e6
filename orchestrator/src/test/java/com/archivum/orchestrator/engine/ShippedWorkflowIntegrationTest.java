package com.archivum.orchestrator.engine;

import com.archivum.orchestrator.executor.TaskExecutor;
import com.archivum.orchestrator.executor.TaskResult;
import com.archivum.orchestrator.model.Job;
import com.archivum.orchestrator.model.PackageStatus;
import com.archivum.orchestrator.model.Task;
import com.archivum.orchestrator.service.JobStore;
import com.archivum.orchestrator.service.TransferService;
import com.archivum.orchestrator.service.TransferService.TransferSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Runs the production workflow graph with every tool mocked to succeed, and
 * checks that each processing switch adds or removes the links it gates.
 */
@SpringBootTest(properties = "archivum.workflow.location=classpath:workflow/workflow.json")
@ActiveProfiles("test")
class ShippedWorkflowIntegrationTest {

    @Autowired TransferService transferService;
    @Autowired WorkflowEngine  engine;
    @Autowired JobStore        store;

    @MockitoBean TaskExecutor executor;

    @TempDir Path source;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(source.resolve("letter.txt"), "a");
        Files.createDirectories(source.resolve("submissionDocumentation"));
        Files.writeString(source.resolve("submissionDocumentation/deed.pdf"), "b");
        Files.createDirectories(source.resolve("metadata"));
        Files.writeString(source.resolve("metadata/metadata.csv"), "c");
        when(executor.execute(any())).thenAnswer(inv -> {
            Instant now = Instant.now();
            return new TaskResult(0, "", "", false, now, now);
        });
    }

    @Test
    void identifySubmissionAndMetadata_enabled_runsOneJobPerSubdirectory() {
        TransferSnapshot snapshot = process(Map.of("identify_submission_and_metadata", true));

        assertThat(snapshot.transfer().getStatus()).isEqualTo(PackageStatus.COMPLETE);
        assertThat(tasksOf(snapshot, "identify-submission-documentation")).extracting(Task::getFilename)
                .containsExactly("objects/submissionDocumentation/deed.pdf");
        assertThat(tasksOf(snapshot, "identify-metadata")).extracting(Task::getFilename)
                .containsExactly("objects/metadata/metadata.csv");
    }

    @Test
    void identifySubmissionAndMetadata_disabled_leavesBothJobsOutOfRead() {
        TransferSnapshot snapshot = process(Map.of("identify_submission_and_metadata", false));

        assertThat(snapshot.transfer().getStatus()).isEqualTo(PackageStatus.COMPLETE);
        assertThat(snapshot.jobs()).extracting(Job::getLinkId)
                .contains("decide-identify-submission-and-metadata", "decide-examine-contents")
                .doesNotContain("identify-submission-documentation", "identify-metadata");
    }

    @ParameterizedTest
    @CsvSource({
            "generate_transfer_structure_report,          generate-structure-report",
            "document_empty_directories,                  document-empty-dirs",
            "extract_packages,                            extract-packages",
            "identify_transfer,                           identify-format",
            "examine_contents,                            examine-contents",
            "perform_policy_checks_on_originals,          policy-checks-originals",
            "identify_before_normalization,               identify-before-normalization",
            "normalize,                                   normalize-for-preservation",
            "transcribe_files,                            transcribe-files",
            "perform_policy_checks_on_access_derivatives, policy-checks-access"
    })
    void booleanSwitch_addsOrRemovesTheLinkItGates(String option, String gatedLink) {
        List<String> enabled  = linkIds(process(Map.of(option, true)));
        List<String> disabled = linkIds(process(Map.of(option, false)));

        assertThat(enabled).contains(gatedLink).endsWith("store-aip");
        assertThat(disabled).doesNotContain(gatedLink).endsWith("store-aip");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TransferSnapshot process(Map<String, Object> config) {
        UUID id = transferService.submit("shipped-" + UUID.randomUUID().toString().substring(0, 8),
                source.toUri().toString(), config).getId();
        engine.run(id);
        TransferSnapshot snapshot = transferService.read(id).orElseThrow();
        assertThat(snapshot.transfer().getStatus()).isEqualTo(PackageStatus.COMPLETE);
        return snapshot;
    }

    private static List<String> linkIds(TransferSnapshot snapshot) {
        return snapshot.jobs().stream().map(Job::getLinkId).toList();
    }

    private List<Task> tasksOf(TransferSnapshot snapshot, String linkId) {
        Job job = snapshot.jobs().stream()
                .filter(j -> j.getLinkId().equals(linkId))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No job for link " + linkId));
        return store.tasksOf(job.getId());
    }
}
