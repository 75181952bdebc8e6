package com.archivum.orchestrator.repository;

import com.archivum.orchestrator.model.TransferVariable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TransferVariableRepository extends JpaRepository<TransferVariable, UUID> {

    List<TransferVariable> findByTransferId(UUID transferId);

    Optional<TransferVariable> findByTransferIdAndName(UUID transferId, String name);
}
