package com.archivum.orchestrator.repository;

import com.archivum.orchestrator.model.Task;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + lookups for the tasks table.
 */
public interface TaskRepository extends JpaRepository<Task, UUID> {

    /** Tasks of a job in insertion order. */
    List<Task> findByJobIdOrderByCreatedAtAsc(UUID jobId);


    boolean existsByJobIdAndFileId(UUID jobId, String fileId);
}
