package com.example.handparse.domain.model;

import com.example.handparse.domain.exception.InvalidCardException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single playing card. Immutable value type; equality is by rank and suit.
 */
public record Card(Rank rank, Suit suit) {

    public Card {
        Objects.requireNonNull(rank, "rank");
        Objects.requireNonNull(suit, "suit");
    }

    /**
     * Parses two-character notation such as {@code "As"} or {@code "Td"}.
     * {@code "10d"} is accepted as an alias for {@code "Td"}.
     *
     * @param notation card notation
     * @return parsed card
     * @throws InvalidCardException when the notation is not a card
     */
    public static Card of(String notation) {
        if (notation == null) {
            throw new InvalidCardException("null");
        }
        String token = notation.trim();
        if (token.length() == 3 && token.startsWith("10")) {
            token = "T" + token.charAt(2);
        }
        if (token.length() != 2) {
            throw new InvalidCardException(notation);
        }
        Rank rank = Rank.fromSymbol(token.charAt(0));
        Suit suit = Suit.fromSymbol(token.charAt(1));
        if (rank == null || suit == null) {
            throw new InvalidCardException(notation);
        }
        return new Card(rank, suit);
    }

    /**
     * Parses a whitespace separated card list, e.g. the inside of {@code [3c 6s 9d]}.
     *
     * @param cards card list without brackets
     * @return cards in the order written
     */
    public static List<Card> listOf(String cards) {
        List<Card> parsed = new ArrayList<>();
        if (cards == null) {
            return parsed;
        }
        for (String token : cards.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                parsed.add(of(token));
            }
        }
        return parsed;
    }

    @Override
    public String toString() {
        return "" + rank.getSymbol() + suit.getSymbol();
    }
}
