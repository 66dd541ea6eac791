package com.capgate.gatekeeper.service;

import com.capgate.gatekeeper.model.*;
import com.capgate.gatekeeper.policy.PolicyEngine;
import com.capgate.gatekeeper.repository.ApprovalRepository;
import com.capgate.gatekeeper.workspace.PatchApplicator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Mediates every side effect an agent asks for.
 *
 * <pre>
 *             decide = auto
 *   request ──────────────────► applied   (effect runs now)
 *      │      decide = review
 *      ├──────────────────────► pending ──approve──► approved (effect runs, payload cleared)
 *      │                           └─────deny──────► denied   (nothing runs, payload cleared)
 *      │      decide = forbid
 *      └──────────────────────► forbidden (no record kept)
 * </pre>
 *
 * The auto path and the approve path both run the effect through
 * {@link #execute}, and for writes that means {@link PatchApplicator}.
 */
@Service
public class ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    /** Recorded as the resolver when the caller does not name one. */
    static final String DEFAULT_ACTOR = "user";

    private final PolicyEngine       policy;
    private final ApprovalRepository approvals;
    private final PatchApplicator    applicator;
    private final MeterRegistry      meterRegistry;

    public ApprovalGate(PolicyEngine policy,
                        ApprovalRepository approvals,
                        PatchApplicator applicator,
                        MeterRegistry meterRegistry) {
        this.policy        = policy;
        this.approvals     = approvals;
        this.applicator    = applicator;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Request
    // ------------------------------------------------------------------

    /**
     * Ask to exercise a capability.
     *
     * The policy is consulted first. A forbidden request returns without
     * looking at the payload and leaves no record. For auto and review the
     * payload is validated before anything is written.
     *
     * @param requestedBy who is asking (agent name), stored on pending records; may be null
     * @throws ApprovalException  MALFORMED_PAYLOAD if the payload does not fit the capability
     * @throws com.capgate.gatekeeper.workspace.WorkspaceException if an auto-approved write fails
     */
    public GateOutcome request(Capability capability, EffectPayload payload, String requestedBy) {
        Decision decision = policy.decide(capability);
        return switch (decision) {
            case FORBID -> forbid(capability, requestedBy);
            case AUTO   -> runNow(capability, payload);
            case REVIEW -> park(capability, payload, requestedBy);
        };
    }

    private GateOutcome forbid(Capability capability, String requestedBy) {
        log.warn("Request for '{}' by {} forbidden by policy {}",
                capability, requestedBy == null ? "unknown" : requestedBy, policy.snapshot().mode());
        countRequest(capability, GateOutcome.Status.FORBIDDEN);
        return GateOutcome.forbidden(capability);
    }

    private GateOutcome runNow(Capability capability, EffectPayload payload) {
        validate(capability, payload);
        Optional<CommitResult> result = execute(capability, payload);
        countRequest(capability, GateOutcome.Status.APPLIED);
        return GateOutcome.applied(capability, result.map(CommitResult::commitSha).orElse(null));
    }

    private GateOutcome park(Capability capability, EffectPayload payload, String requestedBy) {
        validate(capability, payload);
        ApprovalRecord saved = approvals.save(new ApprovalRecord(capability, payload, requestedBy));
        log.info("Request for '{}' requires approval: {}", capability, saved.getId());
        countRequest(capability, GateOutcome.Status.PENDING);
        return GateOutcome.pending(capability, saved.getId());
    }

    // ------------------------------------------------------------------
    // Resolve
    // ------------------------------------------------------------------

    /**
     * Approve or deny a pending record.
     *
     * The row is locked for the whole transaction, so of two concurrent
     * resolutions exactly one sees PENDING; the other gets NOT_PENDING.
     *
     * On approve the stored effect runs first. If it throws, the transaction
     * rolls back and the record stays pending with its payload, ready for
     * another attempt once the cause is fixed.
     *
     * @param actor who resolved it; blank means {@value #DEFAULT_ACTOR}
     * @throws ApprovalNotFoundException if the id is unknown
     * @throws ApprovalException         NOT_PENDING if already resolved
     */
    @Transactional
    public ApprovalRecord resolve(UUID id, Resolution resolution, String actor) {
        ApprovalRecord record = approvals.findByIdForUpdate(id)
                .orElseThrow(() -> new ApprovalNotFoundException(id));
        if (!record.isPending()) {
            throw new ApprovalException(ApprovalException.Kind.NOT_PENDING,
                    "Approval " + id + " is already " + record.getStatus().wireName());
        }
        String resolver = (actor == null || actor.isBlank()) ? DEFAULT_ACTOR : actor.strip();

        switch (resolution) {
            case APPROVE -> {
                validate(record.getCapability(), record.getPayload());
                execute(record.getCapability(), record.getPayload());
                record.approve(resolver);
            }
            case DENY -> record.deny(resolver);
        }

        ApprovalRecord saved = approvals.save(record);
        log.info("Approval {} ({}) {} by {}",
                id, saved.getCapability(), saved.getStatus().wireName(), resolver);
        meterRegistry.counter("capgate.approvals.resolved",
                "capability", saved.getCapability().wireName(),
                "outcome",    saved.getStatus().wireName()).increment();
        return saved;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<ApprovalRecord> get(UUID id) {
        return approvals.findById(id);
    }

    /**
     * All records, or only those in {@code status} when it is non-null,
     * in creation order.
     */
    @Transactional(readOnly = true)
    public List<ApprovalRecord> list(ApprovalStatus status) {
        return status == null
                ? approvals.findAllByOrderByCreatedAtAscIdAsc()
                : approvals.findByStatusOrderByCreatedAtAscIdAsc(status);
    }

    // ------------------------------------------------------------------
    // Effect dispatch
    // ------------------------------------------------------------------

    /**
     * Run the effect behind a capability. Only WRITE has a handler; the
     * other capabilities are decision-only until one is added here.
     */
    private Optional<CommitResult> execute(Capability capability, EffectPayload payload) {
        return switch (capability) {
            case WRITE -> {
                WritePayload write = (WritePayload) payload;
                yield Optional.of(applicator.apply(write.diffs(), write.message()));
            }
            case READ, EXEC, NET, SECRETS, DNS, DEPLOY -> {
                log.info("No effect handler for '{}'; decision recorded only", capability);
                yield Optional.empty();
            }
        };
    }

    private static void validate(Capability capability, EffectPayload payload) {
        if (payload == null) {
            throw malformed("Capability '" + capability + "' requires a payload");
        }
        switch (capability) {
            case WRITE -> validateWrite(payload);
            case READ, EXEC, NET, SECRETS, DNS, DEPLOY -> {
                if (!(payload instanceof DecisionOnlyPayload)) {
                    throw malformed("Capability '" + capability + "' takes an attributes payload");
                }
            }
        }
    }

    private static void validateWrite(EffectPayload payload) {
        if (!(payload instanceof WritePayload write)) {
            throw malformed("Capability 'write' requires a payload with diffs and a message");
        }
        if (write.diffs().isEmpty()) {
            throw malformed("Write payload has no diffs");
        }
        if (write.message() == null || write.message().isBlank()) {
            throw malformed("Write payload has no message");
        }
        for (int i = 0; i < write.diffs().size(); i++) {
            Diff diff = write.diffs().get(i);
            if (diff == null) {
                throw malformed("diffs[" + i + "] is null");
            }
            if (diff.path() == null || diff.path().isBlank()) {
                throw malformed("diffs[" + i + "] has no path");
            }
            if (diff.patch() == null || diff.patch().isBlank()) {
                throw malformed("diffs[" + i + "] (" + diff.path() + ") has no patch");
            }
        }
    }

    private static ApprovalException malformed(String message) {
        return new ApprovalException(ApprovalException.Kind.MALFORMED_PAYLOAD, message);
    }

    private void countRequest(Capability capability, GateOutcome.Status outcome) {
        meterRegistry.counter("capgate.gate.requests",
                "capability", capability.wireName(),
                "outcome",    outcome.wireName()).increment();
    }
}
