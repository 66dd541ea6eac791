package com.capgate.gatekeeper.service;

/** What a human decided about a pending approval. */
public enum Resolution {
    APPROVE,
    DENY
}
