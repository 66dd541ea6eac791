package com.capgate.gatekeeper.api.dto;

import com.capgate.gatekeeper.model.DecisionOnlyPayload;

import java.util.Map;

/**
 * Request body for POST /capabilities/{capability}/requests, used for the
 * capabilities that have no dedicated route. The attributes are stored for
 * the reviewer as-is.
 */
public record CapabilityRequest(Map<String, Object> attributes, String requestedBy) {

    public DecisionOnlyPayload toPayload() {
        return new DecisionOnlyPayload(attributes);
    }
}
