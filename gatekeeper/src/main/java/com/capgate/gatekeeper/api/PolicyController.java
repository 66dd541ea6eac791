package com.capgate.gatekeeper.api;

import com.capgate.gatekeeper.api.dto.ModeRequest;
import com.capgate.gatekeeper.api.dto.ModeResponse;
import com.capgate.gatekeeper.api.dto.PolicyResponse;
import com.capgate.gatekeeper.api.dto.UpdatePolicyRequest;
import com.capgate.gatekeeper.model.Capability;
import com.capgate.gatekeeper.model.Decision;
import com.capgate.gatekeeper.model.Mode;
import com.capgate.gatekeeper.policy.PolicyEngine;
import com.capgate.gatekeeper.policy.PolicySnapshot;
import com.capgate.gatekeeper.policy.PolicyUpdate;
import org.springframework.web.bind.annotation.*;

import java.util.EnumMap;
import java.util.Map;

/**
 * REST API for the policy state.
 *
 * GET /policy : current mode, overrides and effective decisions
 * PUT /policy : {mode?, reset?, overrides?}, applied atomically
 * PUT /mode   : {mode}
 *
 * Unknown mode, capability or decision names are rejected with 400 before
 * anything changes.
 */
@RestController
public class PolicyController {

    private final PolicyEngine policy;

    public PolicyController(PolicyEngine policy) {
        this.policy = policy;
    }

    @GetMapping("/policy")
    public PolicyResponse get() {
        return PolicyResponse.from(policy.snapshot(), policy.effectiveDecisions());
    }

    @PutMapping("/policy")
    public PolicyResponse update(@RequestBody(required = false) UpdatePolicyRequest req) {
        if (req == null) {
            return get();
        }
        // Parse everything first so a bad entry leaves the policy untouched.
        Mode mode = req.mode() == null ? null : Mode.fromWire(req.mode());
        Map<Capability, Decision> overrides = new EnumMap<>(Capability.class);
        if (req.overrides() != null) {
            req.overrides().forEach((c, d) -> overrides.put(Capability.fromWire(c), Decision.fromWire(d)));
        }
        PolicySnapshot snapshot = policy.update(
                new PolicyUpdate(mode, Boolean.TRUE.equals(req.reset()), overrides));
        return PolicyResponse.from(snapshot, policy.effectiveDecisions());
    }

    @PutMapping("/mode")
    public ModeResponse setMode(@RequestBody ModeRequest req) {
        policy.setMode(req.mode());
        return new ModeResponse(policy.snapshot().mode());
    }
}
