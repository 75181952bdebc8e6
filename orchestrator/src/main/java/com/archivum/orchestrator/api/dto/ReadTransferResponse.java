package com.archivum.orchestrator.api.dto;

import com.archivum.orchestrator.model.Job;
import com.archivum.orchestrator.model.Transfer;
import com.archivum.orchestrator.service.TransferService.TransferSnapshot;

import java.util.List;
import java.util.UUID;

/**
 * Response body for GET /transfers/{id}.
 *
 * {@code job} is the Job the package is at (or ended with); null before the
 * engine has started it.
 */
public record ReadTransferResponse(
        UUID          id,
        String        name,
        String        status,
        UUID          job,
        String        failureKind,
        String        failureReason,
        List<JobView> jobs
) {
    public static ReadTransferResponse from(TransferSnapshot snapshot) {
        Transfer t = snapshot.transfer();
        Job current = snapshot.currentJob();
        return new ReadTransferResponse(
                t.getId(),
                t.getName(),
                t.getStatus().name(),
                current == null ? null : current.getId(),
                t.getFailureKind() == null ? null : t.getFailureKind().name(),
                t.getFailureReason(),
                snapshot.jobs().stream().map(JobView::from).toList()
        );
    }
}
