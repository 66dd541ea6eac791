package com.capgate.gatekeeper.policy;

import com.capgate.gatekeeper.model.Capability;
import com.capgate.gatekeeper.model.Decision;
import com.capgate.gatekeeper.model.Mode;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Decides whether a capability request runs, waits for a human, or is refused.
 *
 * State: the active {@link Mode} and a capability → decision override map,
 * shared by every caller in the process. {@link #decide} returns the override
 * when one is set, otherwise the mode default from {@link ModeDefaults}.
 *
 * <p>All state sits behind one read/write lock: decide/snapshot read, the
 * mutators write. A decide that starts after a mutator returns always sees
 * that mutation.
 */
@Component
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ModeDefaults  defaults;
    private final MeterRegistry meterRegistry;

    private Mode mode;
    private final Map<Capability, Decision> overrides = new EnumMap<>(Capability.class);

    /**
     * Built from {@code capgate.policy.*}. Any invalid entry throws here and
     * aborts startup.
     */
    @Autowired
    public PolicyEngine(PolicyProperties properties, MeterRegistry meterRegistry) {
        this(ModeDefaults.builtIn().withReplacements(properties.getDefaults()),
             Mode.fromWire(properties.getMode()),
             meterRegistry);
        properties.getOverrides().forEach((capability, decision) ->
                overrides.put(Capability.fromWire(capability), Decision.fromWire(decision)));
        log.info("Policy engine started in mode '{}' with overrides {}", mode, overrides);
    }

    public PolicyEngine(ModeDefaults defaults, Mode initialMode, MeterRegistry meterRegistry) {
        this.defaults      = defaults;
        this.mode          = initialMode;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Decisions
    // ------------------------------------------------------------------

    public Decision decide(Capability capability) {
        Decision decision;
        lock.readLock().lock();
        try {
            decision = overrides.get(capability);
            if (decision == null) {
                decision = defaults.lookup(mode, capability);
            }
        } finally {
            lock.readLock().unlock();
        }
        meterRegistry.counter("capgate.policy.decisions",
                "capability", capability.wireName(),
                "decision",   decision.wireName()).increment();
        return decision;
    }

    /**
     * @throws PolicyException UNKNOWN_CAPABILITY if the name is not a capability
     */
    public Decision decide(String capability) {
        return decide(Capability.fromWire(capability));
    }

    public PolicySnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new PolicySnapshot(mode, overrides);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ------------------------------------------------------------------
    // Mutators
    // ------------------------------------------------------------------

    /** Switch mode. Overrides are kept. */
    public void setMode(Mode next) {
        lock.writeLock().lock();
        try {
            Mode previous = mode;
            mode = next;
            log.info("Policy mode changed: {} -> {}", previous, next);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws PolicyException INVALID_MODE if the name is not a mode
     */
    public void setMode(String next) {
        setMode(Mode.fromWire(next));
    }

    /** Add or replace the given overrides; capabilities not mentioned are untouched. */
    public void setOverrides(Map<Capability, Decision> entries) {
        lock.writeLock().lock();
        try {
            overrides.putAll(entries);
            log.info("Policy overrides merged {} -> {}", entries, overrides);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Drop every override; all capabilities fall back to the mode defaults. */
    public void resetOverrides() {
        lock.writeLock().lock();
        try {
            overrides.clear();
            log.info("Policy overrides cleared (mode '{}')", mode);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Apply mode, reset and overrides as one step. No reader observes a
     * state between them.
     */
    public PolicySnapshot update(PolicyUpdate update) {
        lock.writeLock().lock();
        try {
            if (update.mode() != null && update.mode() != mode) {
                log.info("Policy mode changed: {} -> {}", mode, update.mode());
                mode = update.mode();
            }
            if (update.reset()) {
                overrides.clear();
            }
            overrides.putAll(update.overrides());
            log.info("Policy updated: mode '{}', overrides {}", mode, overrides);
            return new PolicySnapshot(mode, overrides);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * What {@link #decide} would return for every capability right now.
     * Not counted in the decision metrics.
     */
    public Map<Capability, Decision> effectiveDecisions() {
        lock.readLock().lock();
        try {
            Map<Capability, Decision> effective = new EnumMap<>(defaults.row(mode));
            effective.putAll(overrides);
            return effective;
        } finally {
            lock.readLock().unlock();
        }
    }
}
