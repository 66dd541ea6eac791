package com.capgate.gatekeeper.policy;

import com.capgate.gatekeeper.model.Capability;
import com.capgate.gatekeeper.model.Decision;
import com.capgate.gatekeeper.model.Mode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.capgate.gatekeeper.model.Decision.AUTO;
import static com.capgate.gatekeeper.model.Decision.FORBID;
import static com.capgate.gatekeeper.model.Decision.REVIEW;

/**
 * The mode → capability → decision lookup used when a capability has no
 * override. Immutable, and total by construction: {@link #of} refuses a
 * table with a missing cell.
 *
 * <pre>
 *   mode        read  write   exec    net     secrets dns     deploy
 *   playground  auto  auto    auto    auto    review  auto    review
 *   dev         auto  auto    review  review  forbid  review  review
 *   trusted     auto  auto    auto    auto    review  review  review
 *   prod        auto  review  review  review  forbid  review  review
 * </pre>
 */
public final class ModeDefaults {

    private final Map<Mode, Map<Capability, Decision>> table;

    private ModeDefaults(Map<Mode, Map<Capability, Decision>> table) {
        this.table = table;
    }

    /** The table above. */
    public static ModeDefaults builtIn() {
        Map<Mode, Map<Capability, Decision>> t = new EnumMap<>(Mode.class);
        t.put(Mode.PLAYGROUND, cells(AUTO, AUTO,   AUTO,   AUTO,   REVIEW, AUTO,   REVIEW));
        t.put(Mode.DEV,        cells(AUTO, AUTO,   REVIEW, REVIEW, FORBID, REVIEW, REVIEW));
        t.put(Mode.TRUSTED,    cells(AUTO, AUTO,   AUTO,   AUTO,   REVIEW, REVIEW, REVIEW));
        t.put(Mode.PROD,       cells(AUTO, REVIEW, REVIEW, REVIEW, FORBID, REVIEW, REVIEW));
        return of(t);
    }

    /**
     * Validate and freeze a table.
     *
     * @throws PolicyException INCOMPLETE_TABLE listing every missing (mode, capability) cell
     */
    public static ModeDefaults of(Map<Mode, Map<Capability, Decision>> source) {
        List<String> missing = new ArrayList<>();
        Map<Mode, Map<Capability, Decision>> copy = new EnumMap<>(Mode.class);
        for (Mode mode : Mode.values()) {
            Map<Capability, Decision> row = source.getOrDefault(mode, Map.of());
            Map<Capability, Decision> frozen = new EnumMap<>(Capability.class);
            for (Capability capability : Capability.values()) {
                Decision d = row.get(capability);
                if (d == null) {
                    missing.add(mode.wireName() + "." + capability.wireName());
                } else {
                    frozen.put(capability, d);
                }
            }
            copy.put(mode, Collections.unmodifiableMap(frozen));
        }
        if (!missing.isEmpty()) {
            throw new PolicyException(PolicyException.Kind.INCOMPLETE_TABLE,
                    "Mode defaults table has no decision for " + String.join(", ", missing));
        }
        return new ModeDefaults(Collections.unmodifiableMap(copy));
    }

    /**
     * Copy of this table with the given cells replaced. Keys are wire names
     * as they appear in configuration ({@code prod -> {write -> forbid}}).
     *
     * @throws PolicyException INVALID_MODE / UNKNOWN_CAPABILITY / INVALID_DECISION on a bad key or value
     */
    public ModeDefaults withReplacements(Map<String, Map<String, String>> replacements) {
        if (replacements == null || replacements.isEmpty()) return this;
        Map<Mode, Map<Capability, Decision>> next = new EnumMap<>(Mode.class);
        table.forEach((mode, row) -> next.put(mode, new EnumMap<>(row)));
        replacements.forEach((modeName, row) -> {
            Mode mode = Mode.fromWire(modeName);
            if (row == null) return;
            row.forEach((capabilityName, decisionName) ->
                    next.get(mode).put(Capability.fromWire(capabilityName), Decision.fromWire(decisionName)));
        });
        return of(next);
    }

    public Decision lookup(Mode mode, Capability capability) {
        return table.get(mode).get(capability);
    }

    public Map<Capability, Decision> row(Mode mode) {
        return table.get(mode);
    }

    private static Map<Capability, Decision> cells(Decision read, Decision write, Decision exec,
                                                   Decision net, Decision secrets, Decision dns,
                                                   Decision deploy) {
        Map<Capability, Decision> r = new EnumMap<>(Capability.class);
        r.put(Capability.READ,    read);
        r.put(Capability.WRITE,   write);
        r.put(Capability.EXEC,    exec);
        r.put(Capability.NET,     net);
        r.put(Capability.SECRETS, secrets);
        r.put(Capability.DNS,     dns);
        r.put(Capability.DEPLOY,  deploy);
        return r;
    }
}
