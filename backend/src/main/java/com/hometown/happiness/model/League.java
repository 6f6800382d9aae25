package com.hometown.happiness.model;

import java.util.Locale;

public enum League {
    NHL,
    NFL,
    MLB,
    NBA;

    /** Lowercase code used for id prefixes and exported tables, e.g. "nhl". */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static League fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("League code is required");
        }
        return League.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
