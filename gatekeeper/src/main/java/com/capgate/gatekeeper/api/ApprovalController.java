package com.capgate.gatekeeper.api;

import com.capgate.gatekeeper.api.dto.ApprovalListResponse;
import com.capgate.gatekeeper.api.dto.ApprovalResponse;
import com.capgate.gatekeeper.api.dto.ApprovalSummary;
import com.capgate.gatekeeper.api.dto.ResolveRequest;
import com.capgate.gatekeeper.model.ApprovalStatus;
import com.capgate.gatekeeper.service.ApprovalGate;
import com.capgate.gatekeeper.service.ApprovalNotFoundException;
import com.capgate.gatekeeper.service.Resolution;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API for the human side of the gate.
 *
 * GET  /approvals?status=       : list records, optionally filtered
 * GET  /approvals/{id}          : one record, with its payload while pending
 * POST /approvals/{id}/approve  : run the stored effect and close the record
 * POST /approvals/{id}/deny     : close the record without running anything
 */
@RestController
@RequestMapping("/approvals")
public class ApprovalController {

    private final ApprovalGate gate;

    public ApprovalController(ApprovalGate gate) {
        this.gate = gate;
    }

    @GetMapping
    public ApprovalListResponse list(@RequestParam(required = false) String status) {
        ApprovalStatus filter = ApprovalStatus.parse(status).orElse(null);
        return new ApprovalListResponse(gate.list(filter).stream()
                .map(ApprovalSummary::from)
                .toList());
    }

    /** Returns 404 if the id is not found. */
    @GetMapping("/{id}")
    public ApprovalResponse get(@PathVariable UUID id) {
        return gate.get(id)
                .map(ApprovalResponse::from)
                .orElseThrow(() -> new ApprovalNotFoundException(id));
    }

    /**
     * HTTP 200: approved, effect applied
     * HTTP 400: not pending, or the stored patch no longer applies (record stays pending)
     * HTTP 404: unknown id
     */
    @PostMapping("/{id}/approve")
    public ApprovalResponse approve(@PathVariable UUID id,
                                    @RequestBody(required = false) ResolveRequest req) {
        return ApprovalResponse.from(gate.resolve(id, Resolution.APPROVE, actor(req)));
    }

    @PostMapping("/{id}/deny")
    public ApprovalResponse deny(@PathVariable UUID id,
                                 @RequestBody(required = false) ResolveRequest req) {
        return ApprovalResponse.from(gate.resolve(id, Resolution.DENY, actor(req)));
    }

    private static String actor(ResolveRequest req) {
        return req == null ? null : req.actor();
    }
}
