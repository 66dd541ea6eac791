package com.capgate.gatekeeper.api.dto;

/**
 * Optional body for POST /approvals/{id}/approve and /deny.
 *
 * @param actor Name recorded as resolvedBy; defaults to "user" when omitted.
 */
public record ResolveRequest(String actor) {}
