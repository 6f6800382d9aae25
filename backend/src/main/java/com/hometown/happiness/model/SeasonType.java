package com.hometown.happiness.model;

import java.util.Locale;

public enum SeasonType {
    REGULAR,
    PLAYOFF;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Anything mentioning "playoff" is a playoff game; everything else counts as regular season. */
    public static SeasonType fromLabel(String label) {
        if (label != null && label.toLowerCase(Locale.ROOT).contains("playoff")) {
            return PLAYOFF;
        }
        return REGULAR;
    }
}
