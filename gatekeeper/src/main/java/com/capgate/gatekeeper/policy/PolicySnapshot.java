package com.capgate.gatekeeper.policy;

import com.capgate.gatekeeper.model.Capability;
import com.capgate.gatekeeper.model.Decision;
import com.capgate.gatekeeper.model.Mode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Read-only view of the policy state at one point in time.
 *
 * @param mode      Active mode.
 * @param overrides Explicit per-capability decisions layered on the mode defaults.
 */
public record PolicySnapshot(Mode mode, Map<Capability, Decision> overrides) {

    public PolicySnapshot {
        overrides = overrides.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(overrides));
    }
}
