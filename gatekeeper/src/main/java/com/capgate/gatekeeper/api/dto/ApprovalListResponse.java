package com.capgate.gatekeeper.api.dto;

import java.util.List;

public record ApprovalListResponse(List<ApprovalSummary> records) {}
