package com.archivum.orchestrator.engine;

import com.archivum.orchestrator.config.ArchivumProperties;
import com.archivum.orchestrator.executor.ExecutorException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool shared by every Job in flight.
 *
 * {@link #runAll} is the Job's barrier: it returns only after every submitted
 * task has finished, even when some of them failed.
 */
@Component
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private final ExecutorService workers;

    public TaskDispatcher(ArchivumProperties properties) {
        int size = properties.engine().taskWorkers();
        AtomicInteger n = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "task-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Task worker pool started with {} threads", size);
    }

    /**
     * Run all units of work and wait for every one of them.
     *
     * Results come back in submission order. If any unit threw, the first
     * failure (in submission order) is rethrown once all units are done; later
     * failures are attached as suppressed.
     */
    public <T> List<T> runAll(List<Callable<T>> work) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        List<Future<T>> futures = new ArrayList<>(work.size());
        for (Callable<T> unit : work) {
            futures.add(workers.submit(withContext(unit, context)));
        }

        List<T> results = new ArrayList<>(work.size());
        RuntimeException failure = null;
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (ExecutionException e) {
                RuntimeException cause = unwrap(e.getCause());
                if (failure == null) failure = cause;
                else failure.addSuppressed(cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new ExecutorException("Interrupted while waiting for tasks", e);
            }
        }
        if (failure != null) {
            throw failure;
        }
        return results;
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }

    private static <T> Callable<T> withContext(Callable<T> unit, Map<String, String> context) {
        return () -> {
            if (context != null) MDC.setContextMap(context);
            try {
                return unit.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new ExecutorException("Task worker failed: " + cause, cause);
    }
}
