package com.example.handparse.domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Board texture of a flop. Every flag is a pure function of the three flop cards;
 * the turn and river never change it.
 */
public record FlopTexture(
        boolean rainbow,
        boolean monotone,
        boolean triplet,
        boolean pair,
        boolean flushDraw,
        boolean straightDraw,
        boolean gutshot
) {

    private static final int STRAIGHT_DRAW_SPAN = 3;
    private static final int GUTSHOT_SPAN = 4;

    /**
     * Computes the texture of a flop.
     *
     * @param flop exactly three cards
     * @return texture flags
     * @throws IllegalArgumentException when the list does not hold three cards
     */
    public static FlopTexture of(List<Card> flop) {
        if (flop == null || flop.size() != 3) {
            throw new IllegalArgumentException("A flop has exactly 3 cards: " + flop);
        }
        Set<Suit> suits = new HashSet<>();
        Set<Rank> ranks = new HashSet<>();
        for (Card card : flop) {
            suits.add(card.suit());
            ranks.add(card.rank());
        }
        return new FlopTexture(
                suits.size() == 3,
                suits.size() == 1,
                ranks.size() == 1,
                ranks.size() < 3,
                suits.size() < 3,
                anyPairWithin(flop, STRAIGHT_DRAW_SPAN),
                anyPairWithin(flop, GUTSHOT_SPAN)
        );
    }

    // pairs of equal rank are distance 0 and never count as connected
    private static boolean anyPairWithin(List<Card> flop, int span) {
        for (int i = 0; i < flop.size(); i++) {
            for (int j = i + 1; j < flop.size(); j++) {
                int distance = flop.get(i).rank().distanceTo(flop.get(j).rank());
                if (distance >= 1 && distance <= span) {
                    return true;
                }
            }
        }
        return false;
    }
}
