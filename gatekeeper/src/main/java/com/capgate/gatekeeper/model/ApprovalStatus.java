package com.capgate.gatekeeper.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle of an {@link ApprovalRecord}.
 *
 * Transitions:
 *   PENDING → APPROVED  (effect executed, payload cleared)
 *   PENDING → DENIED    (nothing executed, payload cleared)
 *
 * Both resolved states are terminal.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    DENIED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient lookup used for the optional ?status= filter. */
    public static Optional<ApprovalStatus> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        for (ApprovalStatus s : values()) {
            if (s.wireName().equalsIgnoreCase(value.strip())) {
                return Optional.of(s);
            }
        }
        throw new IllegalArgumentException("Unknown approval status: '" + value + "'");
    }
}
