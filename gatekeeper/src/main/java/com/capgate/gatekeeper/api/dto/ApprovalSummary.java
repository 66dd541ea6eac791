package com.capgate.gatekeeper.api.dto;

import com.capgate.gatekeeper.model.ApprovalRecord;
import com.capgate.gatekeeper.model.ApprovalStatus;
import com.capgate.gatekeeper.model.Capability;

import java.time.Instant;
import java.util.UUID;

/** One row of GET /approvals. Payloads are left out of listings. */
public record ApprovalSummary(UUID id, Capability capability, ApprovalStatus status, Instant createdAt) {

    public static ApprovalSummary from(ApprovalRecord a) {
        return new ApprovalSummary(a.getId(), a.getCapability(), a.getStatus(), a.getCreatedAt());
    }
}
