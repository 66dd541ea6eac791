package com.capgate.gatekeeper.api.dto;

import com.capgate.gatekeeper.model.Diff;
import com.capgate.gatekeeper.model.WritePayload;

import java.util.List;

/**
 * Request body for POST /diffs/apply.
 *
 * Required: diffs (non-empty), message. Optional: requestedBy, the name of
 * the agent proposing the change.
 */
public record ApplyDiffsRequest(List<Diff> diffs, String message, String requestedBy) {

    public WritePayload toPayload() {
        return new WritePayload(diffs, message);
    }
}
