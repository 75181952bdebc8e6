package com.archivum.orchestrator.engine;

import com.archivum.orchestrator.config.ArchivumProperties;
import com.archivum.orchestrator.model.Transfer;
import com.archivum.orchestrator.service.JobStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background loop that hands PROCESSING transfers to the engine.
 *
 * The transfers table is the queue: every tick picks up PROCESSING rows that
 * no package thread is driving yet, oldest first, up to
 * {@code archivum.engine.concurrent-packages}. Transfers left PROCESSING by a
 * previous run of the process are picked up the same way, which is how resume
 * after a restart happens.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "archivum.engine", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class TransferScheduler {

    private static final Logger log = LoggerFactory.getLogger(TransferScheduler.class);

    private final JobStore       store;
    private final WorkflowEngine engine;
    private final int            capacity;

    private final ExecutorService packages;

    // Transfers currently owned by a package thread.
    private final Set<UUID> active = ConcurrentHashMap.newKeySet();

    public TransferScheduler(JobStore store, WorkflowEngine engine, ArchivumProperties properties) {
        this.store    = store;
        this.engine   = engine;
        this.capacity = properties.engine().concurrentPackages();
        AtomicInteger n = new AtomicInteger();
        this.packages = Executors.newFixedThreadPool(capacity, r -> new Thread(r, "package-" + n.incrementAndGet()));
    }

    @Scheduled(fixedDelayString = "${archivum.engine.poll-interval:2s}")
    public void tick() {
        for (Transfer transfer : store.processingTransfers()) {
            if (active.size() >= capacity) {
                return;
            }
            UUID id = transfer.getId();
            if (!active.add(id)) {
                continue;
            }
            log.debug("Dispatching transfer {}", id);
            packages.submit(() -> {
                try {
                    engine.run(id);
                } catch (Exception e) {
                    log.error("Unhandled error while processing transfer {}: {}", id, e.getMessage(), e);
                } finally {
                    active.remove(id);
                }
            });
        }
    }

    int activeCount() {
        return active.size();
    }

    @PreDestroy
    void shutdown() {
        packages.shutdownNow();
    }
}
