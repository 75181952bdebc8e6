package com.archivum.orchestrator.repository;

import com.archivum.orchestrator.model.Job;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + history queries for the jobs table.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /** Job history of a transfer, in creation order. */
    List<Job> findByTransferIdOrderBySequenceAsc(UUID transferId);

    /** Most recent job of a transfer; drives Read's "current job" and resume. */
    Optional<Job> findFirstByTransferIdOrderBySequenceDesc(UUID transferId);

    long countByTransferId(UUID transferId);
}
