package com.archivum.orchestrator.api.dto;

import com.archivum.orchestrator.model.Job;

import java.time.Instant;
import java.util.UUID;

/**
 * One Job as listed by GET /transfers/{id}.
 */
public record JobView(
        UUID    id,
        String  name,
        String  group,
        String  linkId,
        String  originLinkId,
        String  status,
        Integer exitCode,
        String  failureKind,
        Instant startTime,
        Instant finishTime
) {
    public static JobView from(Job job) {
        return new JobView(
                job.getId(),
                job.getName(),
                job.getGroupLabel(),
                job.getLinkId(),
                job.getOriginLinkId(),
                job.getStatus().name(),
                job.getExitCode(),
                job.getFailureKind() == null ? null : job.getFailureKind().name(),
                job.getCreatedAt(),
                job.getFinishedAt()
        );
    }
}
