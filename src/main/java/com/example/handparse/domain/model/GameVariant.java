package com.example.handparse.domain.model;

import java.util.Locale;

/**
 * Poker variant named in the header. The variant decides how many hole cards the hero holds.
 */
public enum GameVariant {
    HOLDEM("Hold'em", 2),
    OMAHA("Omaha", 4),
    OMAHA_HI_LO("Omaha Hi/Lo", 4);

    private final String label;
    private final int holeCardCount;

    GameVariant(String label, int holeCardCount) {
        this.label = label;
        this.holeCardCount = holeCardCount;
    }

    public String getLabel() {
        return label;
    }

    public int getHoleCardCount() {
        return holeCardCount;
    }

	/**
	 * Resolves the variant from the header label.
	 *
	 * @param label text such as {@code "Hold'em"} or {@code "Omaha Hi/Lo"}
	 * @return variant or {@code null} when the label is unknown
	 */
    public static GameVariant fromLabel(String label) {
        if (label == null) {
            return null;
        }
        String normalized = label.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        for (GameVariant variant : values()) {
            if (variant.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return variant;
            }
        }
        return null;
    }
}
