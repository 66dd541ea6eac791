package com.capgate.gatekeeper.api.dto;

import java.util.Map;

/**
 * Request body for PUT /policy. Every field is optional.
 *
 * Applied in order: mode, then reset (clears all overrides), then
 * overrides (merged). An empty body changes nothing.
 */
public record UpdatePolicyRequest(String mode, Boolean reset, Map<String, String> overrides) {}
