package com.capgate.gatekeeper.policy;

import com.capgate.gatekeeper.model.Capability;
import com.capgate.gatekeeper.model.Decision;
import com.capgate.gatekeeper.model.Mode;

import java.util.Map;

/**
 * A combined policy change, applied atomically by
 * {@link PolicyEngine#update(PolicyUpdate)} in field order: mode, reset, overrides.
 *
 * @param mode      New mode, or null to keep the current one.
 * @param reset     Clear all overrides before merging {@code overrides}.
 * @param overrides Entries to add or replace, or null.
 */
public record PolicyUpdate(Mode mode, boolean reset, Map<Capability, Decision> overrides) {

    public PolicyUpdate {
        overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    }
}
