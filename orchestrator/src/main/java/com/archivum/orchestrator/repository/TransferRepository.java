package com.archivum.orchestrator.repository;

import com.archivum.orchestrator.model.FailureKind;
import com.archivum.orchestrator.model.PackageStatus;
import com.archivum.orchestrator.model.Transfer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + lifecycle queries for the transfers table.
 */
public interface TransferRepository extends JpaRepository<Transfer, UUID> {

    /** Transfers the engine still has to drive (also used for resume after a restart). */
    List<Transfer> findByStatusOrderByCreatedAtAsc(PackageStatus status);

    /** Terminal transfers whose working storage has not been purged yet. */
    List<Transfer> findByStatusInAndPurgedAtIsNull(Collection<PackageStatus> statuses);

    /**
     * Move a PROCESSING transfer to a terminal status.
     *
     * The WHERE clause makes this the single, monotonic status transition:
     * it matches nothing once the transfer is terminal.
     *
     * @return 1 if the transfer was finished by this call, 0 if it was already terminal
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Transfer t
            SET t.status = :status, t.failureKind = :kind, t.failureReason = :reason,
                t.finishedAt = :now, t.updatedAt = :now
            WHERE t.id = :id AND t.status = com.archivum.orchestrator.model.PackageStatus.PROCESSING
            """)
    int finish(@Param("id") UUID id,
               @Param("status") PackageStatus status,
               @Param("kind") FailureKind kind,
               @Param("reason") String reason,
               @Param("now") Instant now);
}
