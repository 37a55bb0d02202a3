package com.wheelskills.progress.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import com.wheelskills.progress.error.InvalidStateException;

import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of an attempt. COMPLETED is terminal; there is no way back.
 */
public enum AttemptStatus {
    IN_PROGRESS,
    COMPLETED;

    private static final Map<AttemptStatus, Set<AttemptStatus>> TRANSITIONS = Map.of(
            IN_PROGRESS, Set.of(COMPLETED),
            COMPLETED, Set.of()
    );

    public boolean canTransitionTo(AttemptStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public AttemptStatus transitionTo(AttemptStatus target) {
        if (!canTransitionTo(target)) {
            throw new InvalidStateException("Attempt cannot move from " + code() + " to " + target.code());
        }
        return target;
    }

    public boolean acceptsRecords() {
        return this == IN_PROGRESS;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
