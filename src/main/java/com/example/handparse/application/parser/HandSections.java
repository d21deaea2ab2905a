package com.example.handparse.application.parser;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A hand history cut into its logical blocks.
 *
 * @param headerLine    first non-blank line of the hand
 * @param preambleLines table line, seat lines and forced bets posted before the hole cards
 * @param sections      blocks introduced by a known marker, in marker order
 */
public record HandSections(String headerLine, List<String> preambleLines, Map<SectionMarker, Section> sections) {

    public HandSections {
        preambleLines = List.copyOf(preambleLines);
        sections = sections.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(sections));
    }

    public boolean has(SectionMarker marker) {
        return sections.containsKey(marker);
    }

    /**
     * @param marker section marker
     * @return the section, or {@code null} when the marker never appeared
     */
    public Section get(SectionMarker marker) {
        return sections.get(marker);
    }

    /**
     * Lines of one block.
     *
     * @param marker    marker that opened the block
     * @param boardText text after the closing asterisks, e.g. {@code "[3c 6s 9d] [8d]"}
     * @param lines     trimmed, non-blank lines of the block
     */
    public record Section(SectionMarker marker, String boardText, List<String> lines) {

        public Section {
            lines = List.copyOf(lines);
        }
    }
}
