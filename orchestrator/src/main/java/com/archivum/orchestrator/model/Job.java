package com.archivum.orchestrator.model;

import com.archivum.orchestrator.workflow.Outcome;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One execution of a workflow Link against a Transfer.
 *
 * Created PROCESSING when the engine reaches the Link; completed exactly once
 * with the effective exit code and the routing decision. The routed next link
 * is stored so that a restarted engine can continue from the last completed
 * Job without re-running it.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "transfer_id", nullable = false)
    private Transfer transfer;

    // Position within the transfer's job history (0, 1, 2, ...).
    @Column(name = "seq_no", nullable = false, updatable = false)
    private int sequence;

    @Column(name = "link_id", nullable = false, updatable = false)
    private String linkId;

    @Column(name = "chain_id", updatable = false)
    private String chainId;

    @Column(nullable = false, updatable = false)
    private String name;

    @Column(name = "group_label", updatable = false)
    private String groupLabel;

    // Link whose routing led here; null for the entry link.
    @Column(name = "origin_link_id", updatable = false)
    private String originLinkId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PROCESSING;

    @Column(name = "exit_code")
    private Integer exitCode;

    @Enumerated(EnumType.STRING)
    @Column
    private Outcome outcome;

    @Column(name = "next_link_id")
    private String nextLinkId;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind")
    private FailureKind failureKind;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "finished_at")
    private Instant finishedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(Transfer transfer, int sequence, String linkId, String chainId,
               String name, String groupLabel, String originLinkId) {
        this.transfer     = transfer;
        this.sequence     = sequence;
        this.linkId       = linkId;
        this.chainId      = chainId;
        this.name         = name;
        this.groupLabel   = groupLabel;
        this.originLinkId = originLinkId;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID        getId()            { return id; }
    public Transfer    getTransfer()      { return transfer; }
    public int         getSequence()      { return sequence; }
    public String      getLinkId()        { return linkId; }
    public String      getChainId()       { return chainId; }
    public String      getName()          { return name; }
    public String      getGroupLabel()    { return groupLabel; }
    public String      getOriginLinkId()  { return originLinkId; }
    public JobStatus   getStatus()        { return status; }
    public Integer     getExitCode()      { return exitCode; }
    public Outcome     getOutcome()       { return outcome; }
    public String      getNextLinkId()    { return nextLinkId; }
    public FailureKind getFailureKind()   { return failureKind; }
    public String      getFailureReason() { return failureReason; }
    public Instant     getCreatedAt()     { return createdAt; }
    public Instant     getFinishedAt()    { return finishedAt; }

    public boolean isFinished() {
        return status != JobStatus.PROCESSING;
    }

    // ------------------------------------------------------------------
    // Terminal transitions (JobStore is the only caller)
    // ------------------------------------------------------------------

    /** Record the routing decision. FAIL and REJECT outcomes finish the Job as FAILED. */
    public void route(int exitCode, Outcome outcome, String nextLinkId) {
        requireProcessing();
        this.exitCode   = exitCode;
        this.outcome    = outcome;
        this.nextLinkId = nextLinkId;
        if (outcome == Outcome.FAIL || outcome == Outcome.REJECT) {
            this.status      = JobStatus.FAILED;
            this.failureKind = FailureKind.TOOL;
        } else {
            this.status = JobStatus.COMPLETE;
        }
        this.finishedAt = Instant.now();
    }

    /** Abort without a routing lookup (configuration or infrastructure error). */
    public void abort(FailureKind kind, String reason) {
        requireProcessing();
        this.status        = JobStatus.FAILED;
        this.outcome       = Outcome.FAIL;
        this.failureKind   = kind;
        this.failureReason = reason;
        this.finishedAt    = Instant.now();
    }

    private void requireProcessing() {
        if (isFinished()) {
            throw new IllegalStateException("Job " + id + " is already " + status);
        }
    }
}
