package com.archivum.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One unit of work of a Job: a tool run against a single file, or against the
 * whole package (file id {@link #PACKAGE_FILE_ID}).
 *
 * Written once, after the executor returns; never updated. The (job, file_id)
 * pair is unique, enforced by the uq_tasks_job_file constraint.
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tasks")
public class Task {

    /** File id used by package-level tasks. */
    public static final String PACKAGE_FILE_ID = "";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false, updatable = false)
    private Job job;

    @Column(name = "file_id", nullable = false, updatable = false)
    private String fileId;

    // Path relative to the transfer workspace; empty for package-level tasks.
    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String filename;

    @Column(name = "exit_code", nullable = false, updatable = false)
    private int exitCode;

    // Tool name as registered, e.g. "identify_format".
    @Column(nullable = false, updatable = false)
    private String execution;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String arguments;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String stdout;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String stderr;

    // True when the tool could not be started; exitCode then holds the sentinel.
    @Column(name = "launch_failure", nullable = false, updatable = false)
    private boolean launchFailure;

    @Column(name = "start_time", nullable = false, updatable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false, updatable = false)
    private Instant endTime;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Task() {}   // required by JPA

    public Task(Job job, String fileId, String filename, String execution, String arguments,
                int exitCode, String stdout, String stderr, boolean launchFailure,
                Instant startTime, Instant endTime) {
        this.job           = job;
        this.fileId        = fileId;
        this.filename      = filename;
        this.execution     = execution;
        this.arguments     = arguments;
        this.exitCode      = exitCode;
        this.stdout        = stdout;
        this.stderr        = stderr;
        this.launchFailure = launchFailure;
        this.startTime     = startTime;
        this.endTime       = endTime;
    }

    public UUID    getId()            { return id; }
    public Job     getJob()           { return job; }
    public String  getFileId()        { return fileId; }
    public String  getFilename()      { return filename; }
    public int     getExitCode()      { return exitCode; }
    public String  getExecution()     { return execution; }
    public String  getArguments()     { return arguments; }
    public String  getStdout()        { return stdout; }
    public String  getStderr()        { return stderr; }
    public boolean isLaunchFailure()  { return launchFailure; }
    public Instant getStartTime()     { return startTime; }
    public Instant getEndTime()       { return endTime; }
    public Instant getCreatedAt()     { return createdAt; }
}
