package com.capgate.gatekeeper.model;

import java.util.List;

/**
 * One proposed change to one workspace file.
 *
 * @param path           File path relative to the workspace root. Checked for
 *                       containment when applied, never trusted.
 * @param beforeHash     Hash of the content the patch was generated against (informational).
 * @param afterHash      Hash of the expected result (informational).
 * @param patch          Unified-diff text for this file.
 * @param predictedTests Tests the proposing agent expects to be affected (optional).
 */
public record Diff(
        String       path,
        String       beforeHash,
        String       afterHash,
        String       patch,
        List<String> predictedTests) {

    public Diff {
        predictedTests = predictedTests == null ? List.of() : List.copyOf(predictedTests);
    }

    /** Convenience factory for callers that only have a path and a patch. */
    public static Diff of(String path, String patch) {
        return new Diff(path, null, null, patch, List.of());
    }
}
