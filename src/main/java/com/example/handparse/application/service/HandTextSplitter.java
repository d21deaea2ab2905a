package com.example.handparse.application.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts a history file holding many hands into the text of each hand.
 * A hand starts at every line that opens with a PokerStars hand header; text before the first
 * header is discarded.
 */
@Component
public class HandTextSplitter {

    private static final Pattern HAND_START_PATTERN =
            Pattern.compile("^[ \\t\\uFEFF]*(?<header>PokerStars\\s+(?:Zoom\\s+)?Hand\\s+#)", Pattern.MULTILINE);

    /**
     * @param text history file contents
     * @return one entry per hand, in file order, surrounding blank lines removed
     */
    public List<String> split(String text) {
        List<String> hands = new ArrayList<>();
        if (text == null) {
            return hands;
        }
        Matcher matcher = HAND_START_PATTERN.matcher(text);
        int start = -1;
        while (matcher.find()) {
            if (start >= 0) {
                hands.add(text.substring(start, matcher.start()).strip());
            }
            start = matcher.start("header");
        }
        if (start >= 0) {
            hands.add(text.substring(start).strip());
        }
        return hands;
    }
}
