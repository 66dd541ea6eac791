package com.capgate.gatekeeper.api.dto;

import com.capgate.gatekeeper.model.ApprovalRecord;
import com.capgate.gatekeeper.model.ApprovalStatus;
import com.capgate.gatekeeper.model.Capability;
import com.capgate.gatekeeper.model.EffectPayload;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.UUID;

/**
 * Full view of one approval, returned by GET /approvals/{id} and by the
 * approve/deny routes. {@code payload} is present only while pending.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovalResponse(
        UUID           id,
        Capability     capability,
        ApprovalStatus status,
        EffectPayload  payload,
        String         requestedBy,
        Instant        createdAt,
        Instant        resolvedAt,
        String         resolvedBy
) {
    public static ApprovalResponse from(ApprovalRecord a) {
        return new ApprovalResponse(
                a.getId(),
                a.getCapability(),
                a.getStatus(),
                a.getPayload(),
                a.getRequestedBy(),
                a.getCreatedAt(),
                a.getResolvedAt(),
                a.getResolvedBy()
        );
    }
}
