package com.capgate.gatekeeper.api;

import com.capgate.gatekeeper.api.dto.ApplyDiffsRequest;
import com.capgate.gatekeeper.api.dto.CapabilityRequest;
import com.capgate.gatekeeper.model.Capability;
import com.capgate.gatekeeper.service.ApprovalGate;
import com.capgate.gatekeeper.service.GateOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Entry points through which agents ask for side effects.
 *
 * POST /diffs/apply                        : request the write capability
 * POST /capabilities/{capability}/requests : request any other capability
 *
 * Both return 200 with status "applied" or "pending", or 403 with status
 * "forbidden" when policy refuses the capability.
 */
@RestController
public class CapabilityController {

    private final ApprovalGate gate;

    public CapabilityController(ApprovalGate gate) {
        this.gate = gate;
    }

    /**
     * Apply a batch of diffs, or park it for review.
     *
     * Example:
     *   curl -X POST http://localhost:8080/diffs/apply \
     *     -H "Content-Type: application/json" \
     *     -d '{"diffs":[{"path":"a.txt","patch":"@@ -0,0 +1 @@\n+hello"}],"message":"init"}'
     */
    @PostMapping("/diffs/apply")
    public ResponseEntity<GateOutcome> applyDiffs(@RequestBody ApplyDiffsRequest req) {
        return toResponse(gate.request(Capability.WRITE, req.toPayload(), req.requestedBy()));
    }

    /**
     * Request a decision-only capability (exec, net, deploy, ...).
     * Unknown capability names are rejected with 400.
     */
    @PostMapping("/capabilities/{capability}/requests")
    public ResponseEntity<GateOutcome> requestCapability(@PathVariable String capability,
                                                         @RequestBody(required = false) CapabilityRequest req) {
        Capability cap = Capability.fromWire(capability);
        CapabilityRequest body = req == null ? new CapabilityRequest(null, null) : req;
        return toResponse(gate.request(cap, body.toPayload(), body.requestedBy()));
    }

    private static ResponseEntity<GateOutcome> toResponse(GateOutcome outcome) {
        if (outcome.status() == GateOutcome.Status.FORBIDDEN) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(outcome);
        }
        return ResponseEntity.ok(outcome);
    }
}
