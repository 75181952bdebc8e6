package com.archivum.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One submitted content package, from Submit to its terminal status.
 *
 * Status changes go through {@code TransferRepository.finish}, a conditional
 * update that only matches PROCESSING rows, so a terminal status is written
 * exactly once even if two threads race to finish the same package.
 *
 * DB table: transfers  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "transfers")
public class Transfer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "source_location", nullable = false, columnDefinition = "TEXT")
    private String sourceLocation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PackageStatus status = PackageStatus.PROCESSING;

    // ProcessingConfiguration serialised as JSON; immutable once written.
    @Column(name = "processing_config", nullable = false, columnDefinition = "TEXT")
    private String processingConfig;

    // Directory name under the processing root; equals the transfer UUID.
    @Column(name = "workspace_ref")
    private String workspaceRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind")
    private FailureKind failureKind;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "finished_at")
    private Instant finishedAt;

    // Set by Empty once the working directory has been deleted.
    @Column(name = "purged_at")
    private Instant purgedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Transfer() {}   // required by JPA

    public Transfer(String name, String sourceLocation, String processingConfig) {
        this.name             = name;
        this.sourceLocation   = sourceLocation;
        this.processingConfig = processingConfig;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()               { return id; }
    public String        getName()             { return name; }
    public String        getSourceLocation()   { return sourceLocation; }
    public PackageStatus getStatus()           { return status; }
    public String        getProcessingConfig() { return processingConfig; }
    public String        getWorkspaceRef()     { return workspaceRef; }
    public FailureKind   getFailureKind()      { return failureKind; }
    public String        getFailureReason()    { return failureReason; }
    public Instant       getCreatedAt()        { return createdAt; }
    public Instant       getUpdatedAt()        { return updatedAt; }
    public Instant       getFinishedAt()       { return finishedAt; }
    public Instant       getPurgedAt()         { return purgedAt; }

    public void setWorkspaceRef(String workspaceRef) { this.workspaceRef = workspaceRef; }
    public void setPurgedAt(Instant purgedAt)        { this.purgedAt = purgedAt; }

    /**
     * Terminal transition inside the Submit transaction, when the workspace
     * cannot be created. Everything later goes through TransferRepository.finish.
     */
    public void fail(FailureKind kind, String reason) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Transfer " + id + " is already " + status);
        }
        this.status        = PackageStatus.FAILED;
        this.failureKind   = kind;
        this.failureReason = reason;
        this.finishedAt    = Instant.now();
    }
}
