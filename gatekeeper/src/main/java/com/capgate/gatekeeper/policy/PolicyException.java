package com.capgate.gatekeeper.policy;

/**
 * Thrown for invalid policy input or an invalid policy configuration.
 *
 * INCOMPLETE_TABLE is a startup failure; the other kinds are returned to
 * the immediate caller as input errors.
 */
public class PolicyException extends RuntimeException {

    public enum Kind { INVALID_MODE, UNKNOWN_CAPABILITY, INVALID_DECISION, INCOMPLETE_TABLE }

    private final Kind kind;

    public PolicyException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
