package com.capgate.gatekeeper.service;

import java.util.UUID;

public class ApprovalNotFoundException extends RuntimeException {
    public ApprovalNotFoundException(UUID id) {
        super("No approval with id: '" + id + "'");
    }
}
