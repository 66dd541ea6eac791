package com.capgate.gatekeeper.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload for capabilities that have no effect handler yet. The attributes
 * are kept on the approval record for the human reviewer and otherwise
 * passed through untouched.
 */
public record DecisionOnlyPayload(Map<String, Object> attributes) implements EffectPayload {

    public DecisionOnlyPayload {
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
