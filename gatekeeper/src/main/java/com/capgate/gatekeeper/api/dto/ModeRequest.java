package com.capgate.gatekeeper.api.dto;

/** Request body for PUT /mode. */
public record ModeRequest(String mode) {}
