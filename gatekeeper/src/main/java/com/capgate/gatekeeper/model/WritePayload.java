package com.capgate.gatekeeper.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Payload of a {@link Capability#WRITE} request: a batch of diffs applied
 * in order, plus a commit-style message.
 */
public record WritePayload(List<Diff> diffs, String message) implements EffectPayload {

    // Null entries are kept so validation can report them by index.
    public WritePayload {
        diffs = diffs == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(diffs));
    }
}
