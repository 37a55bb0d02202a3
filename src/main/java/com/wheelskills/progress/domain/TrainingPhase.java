package com.wheelskills.progress.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Set;

/** Training phases and the catalog levels practised in each. */
public enum TrainingPhase {
    FOUNDATION("Foundation", Set.of("easy")),
    MOBILITY("Mobility", Set.of("medium")),
    ADVANCED("Advanced", Set.of("hard", "expert"));

    private final String label;
    private final Set<String> levels;

    TrainingPhase(String label, Set<String> levels) {
        this.label = label;
        this.levels = levels;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public Set<String> levels() {
        return levels;
    }

    public TrainingPhase next() {
        return this == ADVANCED ? ADVANCED : values()[ordinal() + 1];
    }

    public static TrainingPhase fromLabel(String label) {
        return Arrays.stream(values())
                .filter(p -> p.label.equalsIgnoreCase(label) || p.name().equalsIgnoreCase(label))
                .findFirst()
                .orElse(FOUNDATION);
    }
}
