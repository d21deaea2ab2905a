package com.example.handparse.domain.model;

/**
 * The four suits as written in hand histories ({@code c}, {@code d}, {@code h}, {@code s}).
 */
public enum Suit {
    CLUBS('c'),
    DIAMONDS('d'),
    HEARTS('h'),
    SPADES('s');

    private final char symbol;

    Suit(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    /**
     * Resolves a suit from its hand history symbol.
     *
     * @param symbol one of {@code cdhs}, case-insensitive
     * @return matching suit or {@code null} when the symbol is unknown
     */
    public static Suit fromSymbol(char symbol) {
        char lower = Character.toLowerCase(symbol);
        for (Suit suit : values()) {
            if (suit.symbol == lower) {
                return suit;
            }
        }
        return null;
    }
}
