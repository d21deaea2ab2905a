package com.example.handparse.domain.model;

import com.example.handparse.domain.exception.InvalidComboException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hole or shown cards held by one player: two cards for hold'em, four for omaha.
 * The written order is kept for display, but equality ignores it.
 */
public record Combo(List<Card> cards) {

    public Combo {
        if (cards == null || (cards.size() != 2 && cards.size() != 4)) {
            throw new InvalidComboException(render(cards), "a combo holds 2 or 4 cards");
        }
        if (new HashSet<>(cards).size() != cards.size()) {
            throw new InvalidComboException(render(cards), "duplicate card");
        }
        cards = List.copyOf(cards);
    }

    /**
     * Parses compact ({@code "AcKd"}) or spaced ({@code "Ac Kd"}) notation.
     *
     * @param notation card notation
     * @return parsed combo
     */
    public static Combo of(String notation) {
        String compact = notation == null ? "" : notation.replaceAll("\\s+", "");
        if (compact.length() % 2 != 0) {
            throw new InvalidComboException(notation, "odd number of characters");
        }
        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < compact.length(); i += 2) {
            tokens.add(compact.substring(i, i + 2));
        }
        return fromTokens(tokens);
    }

    /**
     * Builds a combo from individual card tokens.
     *
     * @param tokens card tokens such as {@code ["Jd", "Js"]}
     * @return parsed combo
     */
    public static Combo fromTokens(List<String> tokens) {
        return new Combo(tokens.stream().map(Card::of).toList());
    }

    public int size() {
        return cards.size();
    }

    public Set<Card> asSet() {
        return Set.copyOf(cards);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Combo other)) {
            return false;
        }
        return asSet().equals(other.asSet());
    }

    @Override
    public int hashCode() {
        return asSet().hashCode();
    }

    @Override
    public String toString() {
        return render(cards);
    }

    private static String render(List<Card> cards) {
        if (cards == null) {
            return "";
        }
        return cards.stream().map(String::valueOf).collect(Collectors.joining());
    }
}
