package com.capgate.gatekeeper.model;

import com.capgate.gatekeeper.policy.PolicyException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * A class of side effect an agent may ask to perform against the workspace.
 *
 * The set is closed: the policy table, the HTTP layer and the effect
 * dispatcher in the approval gate all switch over it exhaustively, so adding
 * a constant here breaks compilation until every consumer handles it.
 */
public enum Capability {
    READ,
    WRITE,      // the only capability with an effect handler (patch application)
    EXEC,
    NET,
    SECRETS,
    DNS,
    DEPLOY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse the lowercase wire name ("write", "deploy", ...).
     *
     * @throws PolicyException with kind UNKNOWN_CAPABILITY for anything else
     */
    @JsonCreator
    public static Capability fromWire(String value) {
        if (value != null) {
            for (Capability c : values()) {
                if (c.wireName().equalsIgnoreCase(value.strip())) {
                    return c;
                }
            }
        }
        throw new PolicyException(PolicyException.Kind.UNKNOWN_CAPABILITY,
                "Unknown capability: '" + value + "'");
    }

    @Override
    public String toString() {
        return wireName();
    }
}
