package com.capgate.gatekeeper.model;

import java.util.List;

/**
 * Result of applying one batch of diffs.
 *
 * @param commitSha    SHA-256 (hex) of the canonical (diffs, message) tuple.
 *                     An audit and idempotency token, not a VCS commit.
 * @param appliedPaths Workspace-relative paths written, in application order.
 */
public record CommitResult(String commitSha, List<String> appliedPaths) {

    public CommitResult {
        appliedPaths = appliedPaths == null ? List.of() : List.copyOf(appliedPaths);
    }
}
