package com.gridmaze.generator;

import java.util.Locale;

public enum MazeAlgorithm {
    PRIM,
    KRUSKAL,
    /** Opens every interior wall. The result is a fully open room, not a maze. */
    CUSTOM;

    // name in any case, or an ordinal
    public static MazeAlgorithm parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("Algorithm is empty");
        }
        String trimmed = raw.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return fromOrdinal(Integer.parseInt(trimmed));
        }
        try {
            return valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported algorithm: " + raw, ex);
        }
    }

    public static MazeAlgorithm fromOrdinal(int ordinal) {
        MazeAlgorithm[] values = values();
        if (ordinal < 0 || ordinal >= values.length) {
            throw new IllegalArgumentException("Algorithm ordinal " + ordinal + " is out of range 0-" + (values.length - 1));
        }
        return values[ordinal];
    }
}
