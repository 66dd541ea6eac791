package com.capgate.gatekeeper.api.dto;

import com.capgate.gatekeeper.model.Capability;
import com.capgate.gatekeeper.model.Decision;
import com.capgate.gatekeeper.model.Mode;
import com.capgate.gatekeeper.policy.PolicySnapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response body for GET/PUT /policy.
 *
 * @param mode      Active mode.
 * @param overrides Explicit per-capability decisions.
 * @param effective What each capability resolves to right now (defaults + overrides).
 */
public record PolicyResponse(Mode mode, Map<String, String> overrides, Map<String, String> effective) {

    public static PolicyResponse from(PolicySnapshot snapshot, Map<Capability, Decision> effective) {
        return new PolicyResponse(snapshot.mode(), wire(snapshot.overrides()), wire(effective));
    }

    // Keyed by wire name so JSON keys are "write", not "WRITE".
    private static Map<String, String> wire(Map<Capability, Decision> decisions) {
        Map<String, String> out = new LinkedHashMap<>();
        decisions.forEach((c, d) -> out.put(c.wireName(), d.wireName()));
        return out;
    }
}
