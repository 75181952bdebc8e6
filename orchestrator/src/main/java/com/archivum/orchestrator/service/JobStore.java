package com.archivum.orchestrator.service;

import com.archivum.orchestrator.executor.TaskResult;
import com.archivum.orchestrator.model.*;
import com.archivum.orchestrator.repository.JobRepository;
import com.archivum.orchestrator.repository.TaskRepository;
import com.archivum.orchestrator.repository.TransferRepository;
import com.archivum.orchestrator.repository.TransferVariableRepository;
import com.archivum.orchestrator.workflow.Link;
import com.archivum.orchestrator.workflow.Outcome;
import com.archivum.orchestrator.workflow.RouteTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Durable record of Jobs and Tasks, and the only writer of a Transfer's status.
 *
 * Jobs and Tasks are append-only. A Job is mutated exactly once, when it is
 * routed or aborted; a Transfer's status is mutated exactly once, when it
 * becomes terminal. Each public method runs in its own transaction so that
 * concurrent task workers never share one.
 */
@Service
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private final TransferRepository         transferRepo;
    private final JobRepository              jobRepo;
    private final TaskRepository             taskRepo;
    private final TransferVariableRepository variableRepo;

    public JobStore(TransferRepository transferRepo,
                    JobRepository jobRepo,
                    TaskRepository taskRepo,
                    TransferVariableRepository variableRepo) {
        this.transferRepo = transferRepo;
        this.jobRepo      = jobRepo;
        this.taskRepo     = taskRepo;
        this.variableRepo = variableRepo;
    }

    // ------------------------------------------------------------------
    // Transfers
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Transfer> findTransfer(UUID transferId) {
        return transferRepo.findById(transferId);
    }

    /** Transfers still to be driven, oldest first. */
    @Transactional(readOnly = true)
    public List<Transfer> processingTransfers() {
        return transferRepo.findByStatusOrderByCreatedAtAsc(PackageStatus.PROCESSING);
    }

    @Transactional(readOnly = true)
    public PackageStatus statusOf(UUID transferId) {
        return transferRepo.findById(transferId)
                .map(Transfer::getStatus)
                .orElseThrow(() -> new IllegalArgumentException("Unknown transfer " + transferId));
    }

    /**
     * Move a transfer to its terminal status.
     *
     * @return false if the transfer was already terminal (the call is then a no-op)
     */
    @Transactional
    public boolean finishTransfer(UUID transferId, PackageStatus status, FailureKind kind, String reason) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        boolean finished = transferRepo.finish(transferId, status, kind, reason, Instant.now()) == 1;
        if (finished) {
            log.info("Transfer {} finished: {}{}", transferId, status,
                    kind == null ? "" : " (" + kind + ": " + reason + ")");
        } else {
            log.warn("Transfer {} was already terminal; ignoring {}", transferId, status);
        }
        return finished;
    }

    // ------------------------------------------------------------------
    // Jobs
    // ------------------------------------------------------------------

    /**
     * Append a PROCESSING Job for {@code link}.
     *
     * @throws TerminalTransferException if the transfer is no longer PROCESSING
     */
    @Transactional
    public Job startJob(UUID transferId, Link link, String originLinkId) {
        Transfer transfer = transferRepo.findById(transferId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown transfer " + transferId));
        if (transfer.getStatus().isTerminal()) {
            throw new TerminalTransferException(transferId, transfer.getStatus());
        }
        int sequence = (int) jobRepo.countByTransferId(transferId);
        Job job = jobRepo.save(new Job(transfer, sequence, link.id(), link.chainId(),
                link.description(), link.group(), originLinkId));
        log.debug("Job {} started for link '{}' (transfer={}, seq={})",
                job.getId(), link.id(), transferId, sequence);
        return job;
    }

    /**
     * Record the routing decision of a Job. A terminal target also finishes the
     * transfer, in the same transaction, so a crash can never leave a routed
     * terminal Job behind a PROCESSING transfer.
     */
    @Transactional
    public Job routeJob(UUID jobId, int exitCode, RouteTarget target) {
        Job job = jobRepo.findById(jobId).orElseThrow();
        job.route(exitCode, target.outcome(), target.linkId());
        jobRepo.save(job);

        if (target.isTerminal()) {
            UUID transferId = job.getTransfer().getId();
            String reason = target.outcome() == Outcome.COMPLETE ? null
                    : "Link '" + job.getLinkId() + "' routed exit code " + exitCode + " to " + target;
            FailureKind kind = target.outcome() == Outcome.COMPLETE ? null : FailureKind.TOOL;
            finishTransfer(transferId, PackageStatus.of(target.outcome()), kind, reason);
        }
        return job;
    }

    /** Abort a Job without routing and fail its transfer with the same cause. */
    @Transactional
    public Job abortJob(UUID jobId, FailureKind kind, String reason) {
        Job job = jobRepo.findById(jobId).orElseThrow();
        job.abort(kind, reason);
        jobRepo.save(job);
        finishTransfer(job.getTransfer().getId(), PackageStatus.FAILED, kind, reason);
        return job;
    }

    @Transactional(readOnly = true)
    public List<Job> jobsOf(UUID transferId) {
        return jobRepo.findByTransferIdOrderBySequenceAsc(transferId);
    }

    @Transactional(readOnly = true)
    public Optional<Job> lastJob(UUID transferId) {
        return jobRepo.findFirstByTransferIdOrderBySequenceDesc(transferId);
    }

    @Transactional(readOnly = true)
    public Optional<Job> findJob(UUID jobId) {
        return jobRepo.findById(jobId);
    }

    // ------------------------------------------------------------------
    // Tasks
    // ------------------------------------------------------------------

    /**
     * Persist the result of one unit of work.
     *
     * Safe to call concurrently for different files of the same Job. A second
     * task for the same (job, file) pair is refused whether it arrives
     * sequentially or concurrently (the unique constraint catches the race).
     *
     * @throws DuplicateTaskException if the pair already has a task
     */
    @Transactional
    public Task recordTask(UUID jobId, String fileId, String filename,
                           String execution, String arguments, TaskResult result) {
        if (taskRepo.existsByJobIdAndFileId(jobId, fileId)) {
            throw new DuplicateTaskException(jobId, fileId, null);
        }
        Job job = jobRepo.getReferenceById(jobId);
        try {
            return taskRepo.saveAndFlush(new Task(job, fileId, filename, execution, arguments,
                    result.exitCode(), result.stdout(), result.stderr(), result.launchFailure(),
                    result.startTime(), result.endTime()));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateTaskException(jobId, fileId, e);
        }
    }

    @Transactional(readOnly = true)
    public List<Task> tasksOf(UUID jobId) {
        return taskRepo.findByJobIdOrderByCreatedAtAsc(jobId);
    }

    // ------------------------------------------------------------------
    // Transfer variables
    // ------------------------------------------------------------------

    @Transactional
    public void setVariable(UUID transferId, String name, String value, String linkId) {
        TransferVariable variable = variableRepo.findByTransferIdAndName(transferId, name)
                .orElseGet(() -> new TransferVariable(transferId, name));
        variable.assign(value, linkId);
        variableRepo.save(variable);
        log.info("Transfer {} variable '{}' = '{}' (link '{}')", transferId, name, value, linkId);
    }

    @Transactional(readOnly = true)
    public Map<String, String> variables(UUID transferId) {
        return variableRepo.findByTransferId(transferId).stream()
                .collect(Collectors.toMap(TransferVariable::getName,
                        v -> v.getValue() == null ? "" : v.getValue()));
    }
}
