package com.archivum.orchestrator.service;

import com.archivum.orchestrator.model.FailureKind;
import com.archivum.orchestrator.model.PackageStatus;
import com.archivum.orchestrator.model.Transfer;
import com.archivum.orchestrator.processing.InvalidConfigurationException;
import com.archivum.orchestrator.processing.ProcessingConfiguration;
import com.archivum.orchestrator.processing.ProcessingConfigurationResolver;
import com.archivum.orchestrator.repository.TransferRepository;
import com.archivum.orchestrator.storage.StorageUnavailableException;
import com.archivum.orchestrator.storage.WorkspaceManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TransferService: Submit validation and Empty.
 */
@ExtendWith(MockitoExtension.class)
class TransferServiceTest {

    @Mock TransferRepository              transferRepo;
    @Mock JobStore                        store;
    @Mock ProcessingConfigurationResolver configResolver;
    @Mock WorkspaceManager                workspaces;

    @TempDir Path source;

    TransferService service;

    @BeforeEach
    void setUp() {
        service = new TransferService(transferRepo, store, configResolver, workspaces, new ObjectMapper());
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_valid_storesResolvedConfigurationAndCreatesWorkspace() {
        when(configResolver.resolve(anyMap()))
                .thenReturn(new ProcessingConfiguration(1, Map.of("normalize", "true")));
        when(transferRepo.save(any(Transfer.class))).thenAnswer(inv -> withId(inv.getArgument(0)));
        when(workspaces.create(any(), anyString())).thenAnswer(inv -> inv.getArgument(0).toString());

        Transfer transfer = service.submit("  letters ", source.toUri().toString(), Map.of("normalize", true));

        assertThat(transfer.getName()).isEqualTo("letters");
        assertThat(transfer.getStatus()).isEqualTo(PackageStatus.PROCESSING);
        assertThat(transfer.getWorkspaceRef()).isEqualTo(transfer.getId().toString());
        assertThat(transfer.getProcessingConfig()).contains("\"normalize\":\"true\"");
    }

    @Test
    void submit_blankName_isRejectedBeforeAnythingIsWritten() {
        assertThatThrownBy(() -> service.submit(" ", source.toString(), Map.of()))
                .isInstanceOf(InvalidSubmissionException.class)
                .hasMessageContaining("name");
        verifyNoInteractions(transferRepo, workspaces);
    }

    @Test
    void submit_unreadableLocation_isRejected() {
        String missing = source.resolve("does-not-exist").toString();

        assertThatThrownBy(() -> service.submit("letters", missing, Map.of()))
                .isInstanceOf(InvalidSubmissionException.class)
                .hasMessageContaining("not readable");
        verifyNoInteractions(transferRepo, workspaces);
    }

    @Test
    void submit_unsupportedScheme_isRejected() {
        assertThatThrownBy(() -> service.submit("letters", "ftp://host/letters", Map.of()))
                .isInstanceOf(InvalidSubmissionException.class)
                .hasMessageContaining("Invalid location");
        verifyNoInteractions(transferRepo);
    }

    @Test
    void submit_invalidConfiguration_isRejected() {
        when(configResolver.resolve(anyMap()))
                .thenThrow(new InvalidConfigurationException("Unknown processing option 'colour'"));

        assertThatThrownBy(() -> service.submit("letters", source.toString(), Map.of("colour", "red")))
                .isInstanceOf(InvalidSubmissionException.class)
                .hasMessageContaining("colour");
        verifyNoInteractions(transferRepo, workspaces);
    }

    @Test
    void submit_workspaceCannotBeCreated_storesFailedTransfer() {
        when(configResolver.resolve(anyMap())).thenReturn(new ProcessingConfiguration(1, Map.of()));
        when(transferRepo.save(any(Transfer.class))).thenAnswer(inv -> withId(inv.getArgument(0)));
        when(workspaces.create(any(), anyString()))
                .thenThrow(new StorageUnavailableException("disk full", null));

        Transfer transfer = service.submit("letters", source.toString(), Map.of());

        assertThat(transfer.getId()).isNotNull();
        assertThat(transfer.getStatus()).isEqualTo(PackageStatus.FAILED);
        assertThat(transfer.getFailureKind()).isEqualTo(FailureKind.INFRASTRUCTURE);
        assertThat(transfer.getFailureReason()).contains("disk full");
    }

    // ------------------------------------------------------------------
    // empty()
    // ------------------------------------------------------------------

    @Test
    void empty_workspaceDeletionFails_skipsThatTransferAndContinues() {
        Transfer stuck = finished("stuck");
        Transfer done  = finished("done");
        when(transferRepo.findByStatusInAndPurgedAtIsNull(any())).thenReturn(List.of(stuck, done));
        when(workspaces.delete(stuck.getId()))
                .thenThrow(new StorageUnavailableException("permission denied", null));
        when(workspaces.delete(done.getId())).thenReturn(true);

        int purged = service.empty();

        assertThat(purged).isEqualTo(1);
        assertThat(stuck.getPurgedAt()).isNull();
        assertThat(done.getPurgedAt()).isNotNull();
        verify(transferRepo).save(done);
        verify(transferRepo, never()).save(stuck);
    }

    // ------------------------------------------------------------------
    // listTasks()
    // ------------------------------------------------------------------

    @Test
    void listTasks_unknownJob_isEmpty() {
        UUID jobId = UUID.randomUUID();
        when(store.findJob(jobId)).thenReturn(Optional.empty());

        assertThat(service.listTasks(jobId)).isEmpty();
        verify(store, never()).tasksOf(any());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Transfer finished(String name) {
        Transfer transfer = withId(new Transfer(name, "file:///in/" + name, "{}"));
        transfer.fail(FailureKind.TOOL, "failed earlier");
        return transfer;
    }

    private static <T> T withId(T entity) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            if (f.get(entity) == null) {
                f.set(entity, UUID.randomUUID());
            }
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return entity;
    }
}
