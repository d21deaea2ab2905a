package com.example.handparse.domain.model;

import java.util.Locale;

/**
 * Betting structure of the game.
 */
public enum LimitType {
    NO_LIMIT("No Limit"),
    POT_LIMIT("Pot Limit"),
    FIXED_LIMIT("Limit");

    private final String label;

    LimitType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

	/**
	 * Resolves the limit type from the header label, tolerating repeated whitespace.
	 *
	 * @param label text such as {@code "No Limit"} or {@code "Limit"}
	 * @return limit type or {@code null} when the label is unknown
	 */
    public static LimitType fromLabel(String label) {
        if (label == null) {
            return null;
        }
        String normalized = label.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        for (LimitType type : values()) {
            if (type.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
