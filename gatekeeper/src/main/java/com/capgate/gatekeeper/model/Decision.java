package com.capgate.gatekeeper.model;

import com.capgate.gatekeeper.policy.PolicyException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a capability check.
 *
 * These are distinct outcomes, not a severity scale; there is deliberately
 * no ordering between them.
 */
public enum Decision {
    AUTO,       // execute immediately
    REVIEW,     // park the request until a human approves or denies it
    FORBID;     // reject, never executable under the current policy

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Decision fromWire(String value) {
        if (value != null) {
            for (Decision d : values()) {
                if (d.wireName().equalsIgnoreCase(value.strip())) {
                    return d;
                }
            }
        }
        throw new PolicyException(PolicyException.Kind.INVALID_DECISION,
                "Unknown decision: '" + value + "' (expected auto, review or forbid)");
    }

    @Override
    public String toString() {
        return wireName();
    }
}
