package com.archivum.orchestrator.engine;

import com.archivum.orchestrator.executor.ExecutorException;
import com.archivum.orchestrator.executor.TaskExecutor;
import com.archivum.orchestrator.executor.TaskResult;
import com.archivum.orchestrator.executor.TaskSpec;
import com.archivum.orchestrator.model.FailureKind;
import com.archivum.orchestrator.model.Job;
import com.archivum.orchestrator.model.PackageStatus;
import com.archivum.orchestrator.model.Task;
import com.archivum.orchestrator.model.Transfer;
import com.archivum.orchestrator.processing.ProcessingConfiguration;
import com.archivum.orchestrator.processing.ProcessingOption;
import com.archivum.orchestrator.service.JobStore;
import com.archivum.orchestrator.storage.WorkspaceManager;
import com.archivum.orchestrator.workflow.DecisionAction;
import com.archivum.orchestrator.workflow.Link;
import com.archivum.orchestrator.workflow.Outcome;
import com.archivum.orchestrator.workflow.RouteTarget;
import com.archivum.orchestrator.workflow.RunAction;
import com.archivum.orchestrator.workflow.SetVariableAction;
import com.archivum.orchestrator.workflow.UnknownLinkException;
import com.archivum.orchestrator.workflow.WorkflowGraph;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Drives one package through the workflow graph until it reaches a terminal
 * outcome.
 *
 * For each link: start a Job, run its action, reduce the task exit codes to
 * one effective code, route it, and either move on to the next link or finish
 * the package. Progress is persisted after every task and every routing
 * decision, so {@link #run} can be called again after a crash and continues
 * from the last recorded state without repeating finished work.
 *
 * Failure handling:
 * <ul>
 *   <li>tool failures are exit codes and go through the routing table</li>
 *   <li>{@link RoutingException}: the Job is aborted, failure kind CONFIGURATION</li>
 *   <li>{@link ExecutorException}: the Job is aborted, failure kind INFRASTRUCTURE</li>
 * </ul>
 * Either abort also fails the package, so nothing is left PROCESSING.
 */
@Component
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final WorkflowGraph    graph;
    private final JobStore         store;
    private final TaskExecutor     executor;
    private final TaskDispatcher   dispatcher;
    private final WorkspaceManager workspaces;
    private final ObjectMapper     json;
    private final MeterRegistry    meterRegistry;

    public WorkflowEngine(WorkflowGraph graph,
                          JobStore store,
                          TaskExecutor executor,
                          TaskDispatcher dispatcher,
                          WorkspaceManager workspaces,
                          ObjectMapper objectMapper,
                          MeterRegistry meterRegistry) {
        this.graph         = graph;
        this.store         = store;
        this.executor      = executor;
        this.dispatcher    = dispatcher;
        this.workspaces    = workspaces;
        this.json          = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    /** Result of running one link: the effective code and where it routes. */
    record LinkResult(int exitCode, RouteTarget target) {}

    // ------------------------------------------------------------------
    // Entry point (called by TransferScheduler, one thread per package)
    // ------------------------------------------------------------------

    /**
     * Run a package to completion, or resume it. A no-op for terminal packages.
     */
    public void run(UUID transferId) {
        MDC.put("transferId", transferId.toString());
        try {
            Transfer transfer = store.findTransfer(transferId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown transfer " + transferId));
            if (transfer.getStatus().isTerminal()) {
                log.debug("Transfer {} is already {}; nothing to do", transferId, transfer.getStatus());
                return;
            }

            ProcessingConfiguration config;
            try {
                config = json.readValue(transfer.getProcessingConfig(), ProcessingConfiguration.class);
            } catch (JsonProcessingException e) {
                log.error("Stored processing configuration of transfer {} is unreadable", transferId, e);
                finishTransfer(transferId, PackageStatus.FAILED, FailureKind.CONFIGURATION,
                        "Stored processing configuration is unreadable: " + e.getOriginalMessage());
                return;
            }
            if (config.version() != ProcessingOption.VERSION) {
                log.error("Processing configuration of transfer {} has version {}, expected {}",
                        transferId, config.version(), ProcessingOption.VERSION);
                finishTransfer(transferId, PackageStatus.FAILED, FailureKind.CONFIGURATION,
                        "Processing configuration version " + config.version()
                                + " does not match option set version " + ProcessingOption.VERSION);
                return;
            }

            ResumePoint point;
            try {
                Optional<Job> last = store.lastJob(transferId);
                if (last.isPresent() && last.get().isFinished() && last.get().getOutcome().isTerminal()) {
                    // Crashed between the last routing decision and the status update.
                    finishFrom(transferId, last.get());
                    return;
                }
                point = last.map(job -> ResumePoint.from(job, graph)).orElseGet(() -> ResumePoint.start(graph));
                if (last.isPresent()) {
                    log.info("Resuming transfer {} at link '{}'{}", transferId, point.link().id(),
                            point.inFlight() != null ? " (re-entering job " + point.inFlight().getId() + ")" : "");
                } else {
                    log.info("Starting transfer {} '{}'", transferId, transfer.getName());
                }
            } catch (UnknownLinkException e) {
                log.error("Transfer {} cannot be resumed: {}", transferId, e.getMessage());
                finishTransfer(transferId, PackageStatus.FAILED, FailureKind.CONFIGURATION, e.getMessage());
                return;
            }

            drive(transfer, config, point);
        } finally {
            MDC.clear();
        }
    }

    private void drive(Transfer transfer, ProcessingConfiguration config, ResumePoint point) {
        UUID transferId = transfer.getId();
        Link link = point.link();
        String origin = point.originLinkId();
        Job job = point.inFlight();

        while (true) {
            if (job == null) {
                job = store.startJob(transferId, link, origin);
            }
            MDC.put("jobId",  job.getId().toString());
            MDC.put("linkId", link.id());

            LinkResult result;
            try {
                result = execute(transfer, config, link, job);
            } catch (RoutingException e) {
                log.error("Configuration error in transfer {} job {} link '{}': {}",
                        transferId, job.getId(), link.id(), e.getMessage());
                abort(job, FailureKind.CONFIGURATION, e.getMessage());
                return;
            } catch (ExecutorException e) {
                log.error("Infrastructure error in transfer {} job {} link '{}': {}",
                        transferId, job.getId(), link.id(), e.getMessage(), e);
                abort(job, FailureKind.INFRASTRUCTURE, e.getMessage());
                return;
            } catch (RuntimeException e) {
                log.error("Unexpected error in transfer {} job {} link '{}'",
                        transferId, job.getId(), link.id(), e);
                abort(job, FailureKind.INFRASTRUCTURE, "Unexpected error: " + e);
                return;
            }

            store.routeJob(job.getId(), result.exitCode(), result.target());
            log.info("Job '{}' exited {} -> {}", link.description(), result.exitCode(), result.target());

            if (result.target().isTerminal()) {
                countFinished(PackageStatus.of(result.target().outcome()));
                return;
            }
            origin = link.id();
            link = graph.resolve(result.target().linkId());
            job = null;
        }
    }

    // ------------------------------------------------------------------
    // Link actions
    // ------------------------------------------------------------------

    LinkResult execute(Transfer transfer, ProcessingConfiguration config, Link link, Job job) {
        switch (link.actionType()) {
            case DECISION:
                return decide(config, link, (DecisionAction) link.action());
            case SET_VARIABLE:
                SetVariableAction set = (SetVariableAction) link.action();
                String value = CommandTemplate.expand(set.value(), packageVariables(transfer, config));
                store.setVariable(transfer.getId(), set.variable(), value, link.id());
                return routeCode(link, 0);
            case PASS:
                return routeCode(link, 0);
            case RUN:
                return runTool(transfer, config, link, job, (RunAction) link.action());
            default:
                throw new IllegalStateException("Unhandled action type " + link.actionType());
        }
    }

    private LinkResult decide(ProcessingConfiguration config, Link link, DecisionAction decision) {
        String value = config.find(decision.option()).orElseThrow(() -> new RoutingException(link.id(),
                "processing option '" + decision.option() + "' is not set for this package"));
        RouteTarget target = decision.choose(value).orElseThrow(() -> new RoutingException(link.id(),
                "no choice for " + decision.option() + "=" + value));
        log.info("Decision '{}' on {}={}", link.description(), decision.option(), value);
        return new LinkResult(0, target);
    }

    private LinkResult runTool(Transfer transfer, ProcessingConfiguration config, Link link, Job job, RunAction run) {
        UUID transferId = transfer.getId();
        Path workspace = workspaces.workspace(transferId);
        Map<String, String> pkgVars = packageVariables(transfer, config);

        List<WorkUnit> units = new ArrayList<>();
        if (run.perFile()) {
            for (String path : workspaces.listFiles(transferId, run.filterSubdir())) {
                units.add(WorkUnit.forFile(transferId, path));
            }
        } else {
            units.add(WorkUnit.wholePackage());
        }

        // Tasks recorded before a restart are not run again.
        Map<String, Integer> codes = new HashMap<>();
        for (Task done : store.tasksOf(job.getId())) {
            codes.put(done.getFileId(), done.getExitCode());
        }

        List<Callable<Map.Entry<String, Integer>>> pending = new ArrayList<>();
        for (WorkUnit unit : units) {
            if (!codes.containsKey(unit.fileId())) {
                pending.add(() -> Map.entry(unit.fileId(), runTask(transferId, job.getId(), workspace, unit, run, pkgVars)));
            }
        }
        if (pending.size() < units.size()) {
            log.info("Skipping {} task(s) already recorded for job {}", units.size() - pending.size(), job.getId());
        }
        log.debug("Dispatching {} task(s) of '{}'", pending.size(), run.tool());
        for (Map.Entry<String, Integer> finished : dispatcher.runAll(pending)) {
            codes.put(finished.getKey(), finished.getValue());
        }

        return routeCode(link, ExitCodes.effective(codes, run.unanimous()));
    }

    private int runTask(UUID transferId, UUID jobId, Path workspace, WorkUnit unit,
                        RunAction run, Map<String, String> pkgVars) {
        if (!unit.isPackage()) {
            MDC.put("fileId", unit.fileId());
        }
        Path output = workspaces.taskOutputDirectory(transferId, jobId, unit.fileId());
        Map<String, String> vars = CommandTemplate.taskVariables(pkgVars, workspace, unit, output);
        TaskSpec spec = new TaskSpec(transferId, unit.fileId(), run.tool(),
                CommandTemplate.expandAll(run.arguments(), vars), workspace,
                run.timeoutSeconds() > 0 ? Duration.ofSeconds(run.timeoutSeconds()) : null);

        TaskResult result = timed(spec);
        store.recordTask(jobId, unit.fileId(), unit.relativePath(), run.tool(), spec.argumentLine(), result);

        if (result.launchFailure()) {
            log.warn("Tool '{}' could not be launched for '{}': {}", run.tool(), unit.relativePath(), result.stderr());
        } else if (!result.success()) {
            log.info("Tool '{}' exited {} for '{}'", run.tool(), result.exitCode(), unit.relativePath());
        }
        return result.exitCode();
    }

    private TaskResult timed(TaskSpec spec) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            TaskResult result = executor.execute(spec);
            outcome = result.launchFailure() ? "launch_failure" : result.success() ? "success" : "failure";
            return result;
        } finally {
            sample.stop(meterRegistry.timer("archivum.task.duration", "tool", spec.tool()));
            meterRegistry.counter("archivum.task.calls", "tool", spec.tool(), "result", outcome).increment();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Map<String, String> packageVariables(Transfer transfer, ProcessingConfiguration config) {
        return CommandTemplate.packageVariables(transfer, workspaces.workspace(transfer.getId()), config,
                store.variables(transfer.getId()));
    }

    private static LinkResult routeCode(Link link, int exitCode) {
        RouteTarget target = link.routing().route(exitCode).orElseThrow(() -> new RoutingException(link.id(),
                "exit code " + exitCode + " has no route and the link has no default"));
        return new LinkResult(exitCode, target);
    }

    private void abort(Job job, FailureKind kind, String reason) {
        store.abortJob(job.getId(), kind, reason);
        countFinished(PackageStatus.FAILED);
    }

    /** Apply the terminal outcome of an already routed Job to its transfer. */
    private void finishFrom(UUID transferId, Job last) {
        PackageStatus status = PackageStatus.of(last.getOutcome());
        if (finishTransfer(transferId, status, last.getFailureKind(), last.getFailureReason())) {
            log.info("Transfer finished from job {} after restart: {}", last.getId(), status);
        }
    }

    private boolean finishTransfer(UUID transferId, PackageStatus status, FailureKind kind, String reason) {
        boolean finished = store.finishTransfer(transferId, status, kind, reason);
        if (finished) {
            countFinished(status);
        }
        return finished;
    }

    private void countFinished(PackageStatus status) {
        meterRegistry.counter("archivum.transfer.finished", "status", status.name().toLowerCase()).increment();
    }
}
