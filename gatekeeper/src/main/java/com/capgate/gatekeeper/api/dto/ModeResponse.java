package com.capgate.gatekeeper.api.dto;

import com.capgate.gatekeeper.model.Mode;

public record ModeResponse(Mode mode) {}
