package com.example.handparse.domain.model;

/**
 * Real money (any resolved currency, StarsCoin included) versus play chips.
 */
public enum MoneyType {
    REAL,
    PLAY;

    public static MoneyType of(Currency currency) {
        return currency == null ? PLAY : REAL;
    }
}
