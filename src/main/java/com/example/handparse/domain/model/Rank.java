package com.example.handparse.domain.model;

/**
 * The 13 poker ranks, declared from deuce to ace so that ordinal order is strength order.
 */
public enum Rank {
    TWO('2'),
    THREE('3'),
    FOUR('4'),
    FIVE('5'),
    SIX('6'),
    SEVEN('7'),
    EIGHT('8'),
    NINE('9'),
    TEN('T'),
    JACK('J'),
    QUEEN('Q'),
    KING('K'),
    ACE('A');

    private final char symbol;

    Rank(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    /**
     * Number of rank steps between this rank and another, ignoring direction.
     * Aces only count as high.
     *
     * @param other rank to compare against
     * @return absolute ordinal distance (0 for equal ranks)
     */
    public int distanceTo(Rank other) {
        return Math.abs(ordinal() - other.ordinal());
    }

    /**
     * Resolves a rank from its hand history symbol.
     *
     * @param symbol one of {@code 23456789TJQKA}, case-insensitive
     * @return matching rank or {@code null} when the symbol is unknown
     */
    public static Rank fromSymbol(char symbol) {
        char upper = Character.toUpperCase(symbol);
        for (Rank rank : values()) {
            if (rank.symbol == upper) {
                return rank;
            }
        }
        return null;
    }
}
