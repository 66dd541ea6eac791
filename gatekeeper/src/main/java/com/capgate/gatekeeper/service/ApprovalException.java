package com.capgate.gatekeeper.service;

/**
 * Thrown when a capability request or a resolution is rejected as input.
 *
 * Raised before any state is touched, and never retried by the gate itself.
 */
public class ApprovalException extends RuntimeException {

    public enum Kind { MALFORMED_PAYLOAD, NOT_PENDING }

    private final Kind kind;

    public ApprovalException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
