package com.archivum.orchestrator.service;

import com.archivum.orchestrator.executor.ExecutorException;
import com.archivum.orchestrator.model.FailureKind;
import com.archivum.orchestrator.model.Job;
import com.archivum.orchestrator.model.PackageStatus;
import com.archivum.orchestrator.model.Task;
import com.archivum.orchestrator.model.Transfer;
import com.archivum.orchestrator.processing.InvalidConfigurationException;
import com.archivum.orchestrator.processing.ProcessingConfiguration;
import com.archivum.orchestrator.processing.ProcessingConfigurationResolver;
import com.archivum.orchestrator.repository.TransferRepository;
import com.archivum.orchestrator.storage.WorkspaceManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The four operations exposed to callers: Submit, Read, ListTasks and Empty.
 *
 * Submit validates everything before it writes anything. Once a transfer is
 * saved, the engine owns it and callers only ever observe its status.
 */
@Service
public class TransferService {

    private static final Logger log = LoggerFactory.getLogger(TransferService.class);

    private final TransferRepository              transferRepo;
    private final JobStore                        store;
    private final ProcessingConfigurationResolver configResolver;
    private final WorkspaceManager                workspaces;
    private final ObjectMapper                    json;

    public TransferService(TransferRepository transferRepo,
                           JobStore store,
                           ProcessingConfigurationResolver configResolver,
                           WorkspaceManager workspaces,
                           ObjectMapper objectMapper) {
        this.transferRepo   = transferRepo;
        this.store          = store;
        this.configResolver = configResolver;
        this.workspaces     = workspaces;
        this.json           = objectMapper;
    }

    /** A transfer with its Jobs in creation order. */
    public record TransferSnapshot(Transfer transfer, List<Job> jobs) {

        /** The Job the package is at, or ended with; null before the first Job. */
        public Job currentJob() {
            return jobs.isEmpty() ? null : jobs.get(jobs.size() - 1);
        }
    }

    // ------------------------------------------------------------------
    // Submit
    // ------------------------------------------------------------------

    /**
     * Validate and accept a package. The scheduler picks it up on its next tick.
     *
     * A workspace that cannot be created still yields an id: the transfer is
     * stored FAILED (INFRASTRUCTURE) so the caller can Read why.
     *
     * @throws InvalidSubmissionException for a blank name, an unreadable
     *                                    location or an invalid configuration
     */
    @Transactional
    public Transfer submit(String name, String location, Map<String, ?> config) {
        if (name == null || name.isBlank()) {
            throw new InvalidSubmissionException("name is required");
        }
        Path source;
        try {
            source = WorkspaceManager.toLocalPath(location);
        } catch (IllegalArgumentException e) {
            throw new InvalidSubmissionException("Invalid location: " + e.getMessage(), e);
        }
        if (!Files.isReadable(source)) {
            throw new InvalidSubmissionException("Location is not readable: " + location);
        }

        ProcessingConfiguration resolved;
        try {
            resolved = configResolver.resolve(config);
        } catch (InvalidConfigurationException e) {
            throw new InvalidSubmissionException(e.getMessage(), e);
        }

        Transfer transfer = transferRepo.save(new Transfer(name.strip(), location, toJson(resolved)));
        try {
            transfer.setWorkspaceRef(workspaces.create(transfer.getId(), location));
            log.info("Transfer {} '{}' submitted from {}", transfer.getId(), transfer.getName(), location);
        } catch (ExecutorException e) {
            log.error("Workspace creation failed for transfer {}", transfer.getId(), e);
            transfer.fail(FailureKind.INFRASTRUCTURE, "Workspace creation failed: " + e.getMessage());
        }
        return transferRepo.save(transfer);
    }

    // ------------------------------------------------------------------
    // Read / ListTasks
    // ------------------------------------------------------------------

    public Optional<TransferSnapshot> read(UUID transferId) {
        return store.findTransfer(transferId)
                .map(t -> new TransferSnapshot(t, store.jobsOf(transferId)));
    }

    /** Empty when the Job does not exist. */
    public Optional<List<Task>> listTasks(UUID jobId) {
        return store.findJob(jobId).map(job -> store.tasksOf(jobId));
    }

    // ------------------------------------------------------------------
    // Empty
    // ------------------------------------------------------------------

    /**
     * Delete the working storage of every terminal transfer not purged yet.
     * PROCESSING transfers are never touched. A workspace that cannot be
     * deleted is logged and left for the next call.
     *
     * @return number of transfers purged by this call
     */
    public int empty() {
        List<Transfer> candidates = transferRepo.findByStatusInAndPurgedAtIsNull(
                EnumSet.of(PackageStatus.COMPLETE, PackageStatus.FAILED, PackageStatus.REJECTED));
        int purged = 0;
        for (Transfer transfer : candidates) {
            try {
                workspaces.delete(transfer.getId());
            } catch (ExecutorException e) {
                log.warn("Could not purge transfer {}: {}", transfer.getId(), e.getMessage());
                continue;
            }
            transfer.setPurgedAt(Instant.now());
            transferRepo.save(transfer);
            purged++;
        }
        log.info("Empty purged {} of {} terminal transfer(s)", purged, candidates.size());
        return purged;
    }

    private String toJson(ProcessingConfiguration config) {
        try {
            return json.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise processing configuration", e);
        }
    }
}
