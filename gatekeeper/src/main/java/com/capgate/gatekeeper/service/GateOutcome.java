package com.capgate.gatekeeper.service;

import com.capgate.gatekeeper.model.Capability;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.UUID;

/**
 * Result of {@link ApprovalGate#request}.
 *
 * @param status     applied, pending or forbidden.
 * @param capability The capability that was requested.
 * @param commitSha  Set when a write was applied immediately.
 * @param approvalId Set when the request was parked for review.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GateOutcome(Status status, Capability capability, String commitSha, UUID approvalId) {

    public enum Status {
        APPLIED,
        PENDING,
        FORBIDDEN;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static GateOutcome applied(Capability capability, String commitSha) {
        return new GateOutcome(Status.APPLIED, capability, commitSha, null);
    }

    public static GateOutcome pending(Capability capability, UUID approvalId) {
        return new GateOutcome(Status.PENDING, capability, null, approvalId);
    }

    public static GateOutcome forbidden(Capability capability) {
        return new GateOutcome(Status.FORBIDDEN, capability, null, null);
    }
}
