package com.capgate.gatekeeper.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A capability request parked until a human approves or denies it.
 *
 * Created only in PENDING by the approval gate. The payload is non-null
 * exactly while the record is PENDING: resolving it either way clears the
 * payload, so a resolved record can never be executed again.
 *
 * DB table: approvals  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "approvals")
public class ApprovalRecord {

    // Assigned up front so the id can be returned before the row is flushed.
    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Capability capability;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ApprovalStatus status = ApprovalStatus.PENDING;

    // JSON text; null once resolved.
    @Convert(converter = EffectPayloadConverter.class)
    @Column(name = "payload_json", columnDefinition = "TEXT")
    private EffectPayload payload;

    @Column(name = "requested_by")
    private String requestedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolved_by")
    private String resolvedBy;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected ApprovalRecord() {}   // required by JPA

    public ApprovalRecord(Capability capability, EffectPayload payload, String requestedBy) {
        this.id          = UUID.randomUUID();
        this.capability  = capability;
        this.payload     = payload;
        this.requestedBy = requestedBy;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public void approve(String actor) {
        resolve(ApprovalStatus.APPROVED, actor);
    }

    public void deny(String actor) {
        resolve(ApprovalStatus.DENIED, actor);
    }

    private void resolve(ApprovalStatus outcome, String actor) {
        if (status != ApprovalStatus.PENDING) {
            throw new IllegalStateException("Approval " + id + " is already " + status.wireName());
        }
        this.status     = outcome;
        this.resolvedBy = actor;
        this.resolvedAt = Instant.now();
        this.payload    = null;
    }

    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID           getId()          { return id; }
    public Capability     getCapability()  { return capability; }
    public ApprovalStatus getStatus()      { return status; }
    public EffectPayload  getPayload()     { return payload; }
    public String         getRequestedBy() { return requestedBy; }
    public Instant        getCreatedAt()   { return createdAt; }
    public Instant        getResolvedAt()  { return resolvedAt; }
    public String         getResolvedBy()  { return resolvedBy; }
}
