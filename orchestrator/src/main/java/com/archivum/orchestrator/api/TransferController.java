package com.archivum.orchestrator.api;

import com.archivum.orchestrator.api.dto.*;
import com.archivum.orchestrator.model.Transfer;
import com.archivum.orchestrator.service.TransferService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for package processing.
 *
 * POST /transfers              submit a package
 * GET  /transfers/{id}         status, current job and job list
 * GET  /jobs/{jobId}/tasks     tasks of one job
 * POST /transfers/empty        purge working storage of finished packages
 */
@RestController
public class TransferController {

    private final TransferService transferService;

    public TransferController(TransferService transferService) {
        this.transferService = transferService;
    }

    /**
     * Submit a package.
     *
     * Example:
     *   curl -X POST http://localhost:8080/transfers \
     *     -H "Content-Type: application/json" \
     *     -d '{"name":"letters-1921","url":"file:///data/incoming/letters-1921","config":{"normalize":false}}'
     */
    @PostMapping("/transfers")
    public ResponseEntity<SubmitTransferResponse> submit(@RequestBody SubmitTransferRequest req) {
        Transfer transfer = transferService.submit(req.name(), req.url(), req.config());
        return ResponseEntity.status(HttpStatus.CREATED).body(new SubmitTransferResponse(transfer.getId()));
    }

    /**
     * Returns 404 only for ids that were never submitted.
     */
    @GetMapping("/transfers/{id}")
    public ReadTransferResponse read(@PathVariable UUID id) {
        return transferService.read(id)
                .map(ReadTransferResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Transfer not found: " + id));
    }

    @GetMapping("/jobs/{jobId}/tasks")
    public List<TaskView> listTasks(@PathVariable UUID jobId) {
        return transferService.listTasks(jobId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Job not found: " + jobId))
                .stream()
                .map(TaskView::from)
                .toList();
    }

    @PostMapping("/transfers/empty")
    public EmptyResponse empty() {
        return new EmptyResponse(transferService.empty());
    }
}
