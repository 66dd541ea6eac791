package com.capgate.gatekeeper.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The effect a capability request wants performed, stored on pending
 * approval records until a human resolves them.
 *
 * Tagged by {@code kind} in its JSON form so a stored payload round-trips
 * to the same variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WritePayload.class,        name = "write"),
        @JsonSubTypes.Type(value = DecisionOnlyPayload.class, name = "decision_only")
})
public sealed interface EffectPayload permits WritePayload, DecisionOnlyPayload {
}
