package com.capgate.gatekeeper.model;

import com.capgate.gatekeeper.policy.PolicyException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Process-wide operating posture. Selects the default {@link Decision}
 * for every capability that has no explicit override.
 */
public enum Mode {
    PLAYGROUND,
    DEV,
    TRUSTED,
    PROD;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Mode fromWire(String value) {
        if (value != null) {
            for (Mode m : values()) {
                if (m.wireName().equalsIgnoreCase(value.strip())) {
                    return m;
                }
            }
        }
        throw new PolicyException(PolicyException.Kind.INVALID_MODE,
                "Unknown mode: '" + value + "' (expected playground, dev, trusted or prod)");
    }

    @Override
    public String toString() {
        return wireName();
    }
}
