package com.example.handparse.application.parser;

import java.util.Locale;

/**
 * Stand-alone {@code *** NAME ***} separator lines that divide a hand history into sections.
 */
public enum SectionMarker {
    HOLE_CARDS("HOLE CARDS"),
    FLOP("FLOP"),
    TURN("TURN"),
    RIVER("RIVER"),
    SHOW_DOWN("SHOW DOWN"),
    SUMMARY("SUMMARY");

    private final String label;

    SectionMarker(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

	/**
	 * Resolves a marker from the text between the asterisks, ignoring case and spacing
	 * ({@code "Show Down"}, {@code "SHOWDOWN"} and {@code "SHOW  DOWN"} are the same marker).
	 *
	 * @param text marker text
	 * @return marker or {@code null} for markers the parser does not know
	 */
    public static SectionMarker fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        for (SectionMarker marker : values()) {
            if (marker.label.replace(" ", "").equals(normalized)) {
                return marker;
            }
        }
        return null;
    }
}
