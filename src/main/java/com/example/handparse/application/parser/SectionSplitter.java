package com.example.handparse.application.parser;

import com.example.handparse.application.parser.HandSections.Section;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the raw text of one hand into header, preamble and marker sections.
 * <p>
 * A block ends at the next marker line or at the first blank line after it has content;
 * anything between that blank line and the next marker is dropped. Missing markers simply
 * leave their section out. When a marker repeats, the first occurrence wins.
 */
@Component
public class SectionSplitter {

    private static final Pattern MARKER_PATTERN =
            Pattern.compile("^\\*{3}\\s*(?<marker>[A-Za-z][A-Za-z ]*?)\\s*\\*{3}\\s*(?<rest>.*)$");

    /**
     * Splits a hand history.
     *
     * @param rawText complete text of a single hand
     * @return split sections, with a {@code null} header line when the text is blank
     */
    public HandSections split(String rawText) {
        String headerLine = null;
        List<String> preamble = new ArrayList<>();
        Map<SectionMarker, Section> sections = new EnumMap<>(SectionMarker.class);

        SectionMarker current = null;
        String boardText = null;
        List<String> currentLines = null;
        boolean closed = false;

        for (String rawLine : (rawText == null ? "" : rawText).split("\\R")) {
            String line = rawLine.strip();
            if (headerLine == null) {
                if (!line.isEmpty()) {
                    headerLine = line;
                }
                continue;
            }

            SectionMarker marker = null;
            Matcher matcher = MARKER_PATTERN.matcher(line);
            if (matcher.matches()) {
                marker = SectionMarker.fromText(matcher.group("marker"));
            }
            if (marker != null) {
                store(sections, current, boardText, currentLines);
                current = marker;
                boardText = matcher.group("rest").strip();
                currentLines = new ArrayList<>();
                closed = false;
                continue;
            }

            if (current == null) {
                if (!line.isEmpty()) {
                    preamble.add(line);
                }
                continue;
            }
            if (line.isEmpty()) {
                closed = closed || !currentLines.isEmpty();
                continue;
            }
            if (!closed) {
                currentLines.add(line);
            }
        }
        store(sections, current, boardText, currentLines);
        return new HandSections(headerLine, preamble, sections);
    }

    private static void store(Map<SectionMarker, Section> sections, SectionMarker marker,
                              String boardText, List<String> lines) {
        if (marker != null) {
            sections.putIfAbsent(marker, new Section(marker, boardText, lines));
        }
    }
}
