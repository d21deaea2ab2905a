package com.example.handparse.domain.model;

/**
 * Betting rounds that deal board cards.
 */
public enum StreetName {
    FLOP(3),
    TURN(1),
    RIVER(1);

    private final int dealtCards;

    StreetName(int dealtCards) {
        this.dealtCards = dealtCards;
    }

    /**
     * @return number of board cards this street adds
     */
    public int getDealtCards() {
        return dealtCards;
    }
}
