package com.example.handparse.application.service;

import com.example.handparse.HandFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for splitting history files into hands.
 */
class HandTextSplitterTest {

    private final HandTextSplitter splitter = new HandTextSplitter();

    @Test
    void splitsOnEveryHeader() {
        String text = HandFixtures.load(HandFixtures.FLOP_ONLY) + "\n\n\n" + HandFixtures.load(HandFixtures.NO_FLOP);

        List<String> hands = splitter.split(text);

        assertThat(hands).hasSize(2);
        assertThat(hands.get(0)).startsWith("PokerStars Hand #105024000105");
        assertThat(hands.get(0)).endsWith("Seat 9: STBIJUJA folded before Flop (didn't bet)");
        assertThat(hands.get(1)).startsWith("PokerStars Hand #105026771696");
    }

    /**
     * Text before the first header, including a byte order mark, is not part of any hand.
     */
    @Test
    void dropsLeadingNoise() {
        String text = "exported by some tool\n\uFEFFPokerStars Zoom Hand #1: rest of header\nline\n";

        assertThat(splitter.split(text)).containsExactly("PokerStars Zoom Hand #1: rest of header\nline");
    }

    @Test
    void textWithoutHeadersHasNoHands() {
        assertThat(splitter.split("nothing to see")).isEmpty();
        assertThat(splitter.split(null)).isEmpty();
    }
}
