package com.archivum.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A named value set on a Transfer by a set-variable Link.
 * Available to later command templates as {@code %name%}.
 *
 * DB table: transfer_variables  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "transfer_variables")
public class TransferVariable {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "transfer_id", nullable = false, updatable = false)
    private UUID transferId;

    @Column(name = "variable_name", nullable = false, updatable = false)
    private String name;

    @Column(name = "variable_value", columnDefinition = "TEXT")
    private String value;

    @Column(name = "link_id")
    private String linkId;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    protected TransferVariable() {}   // required by JPA

    public TransferVariable(UUID transferId, String name) {
        this.transferId = transferId;
        this.name       = name;
    }

    public UUID    getId()         { return id; }
    public UUID    getTransferId() { return transferId; }
    public String  getName()       { return name; }
    public String  getValue()      { return value; }
    public String  getLinkId()     { return linkId; }
    public Instant getUpdatedAt()  { return updatedAt; }

    public void assign(String value, String linkId) {
        this.value     = value;
        this.linkId    = linkId;
        this.updatedAt = Instant.now();
    }
}
