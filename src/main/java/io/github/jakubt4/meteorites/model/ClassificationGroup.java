package io.github.jakubt4.meteorites.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Coarse scientific category assigned to every meteorite by
 * {@link io.github.jakubt4.meteorites.service.MeteoriteClassifier}.
 */
public enum ClassificationGroup {

    L_TYPE("L-type"),
    H_TYPE("H-type"),
    LL_TYPE("LL-type"),
    CARBONACEOUS("Carbonaceous"),
    ENSTATITE("Enstatite"),
    ACHONDRITE("Achondrite"),
    IRON("Iron"),
    MESOSIDERITE("Mesosiderite"),
    MARTIAN("Martian"),
    LUNAR("Lunar"),
    PALLASITE("Pallasite"),
    UNKNOWN("Unknown"),
    OTHER("Other");

    private final String label;

    ClassificationGroup(final String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<ClassificationGroup> fromLabel(final String label) {
        return Arrays.stream(values())
                .filter(group -> group.label.equals(label))
                .findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
