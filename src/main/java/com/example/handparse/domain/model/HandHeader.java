package com.example.handparse.domain.model;

import java.math.BigDecimal;
import java.time.ZonedDateTime;

/**
 * Everything the first line of a hand history says about the hand.
 *
 * @param handId     room hand number
 * @param gameType   cash or tournament, decided by the tournament id alone
 * @param tournament tournament context, {@code null} for cash hands
 * @param currency   resolved currency, {@code null} for play money
 * @param moneyType  real or play, derived from {@code currency}
 * @param smallBlind small blind in chips or currency units
 * @param bigBlind   big blind in chips or currency units
 * @param limit      betting structure
 * @param game       poker variant
 * @param date       canonical timestamp in the room's reference zone
 */
public record HandHeader(
        String handId,
        GameType gameType,
        TournamentInfo tournament,
        Currency currency,
        MoneyType moneyType,
        BigDecimal smallBlind,
        BigDecimal bigBlind,
        LimitType limit,
        GameVariant game,
        ZonedDateTime date
) {

    /**
     * @return tournament buy-in, {@code null} for cash hands
     */
    public BigDecimal buyIn() {
        return tournament == null ? null : tournament.buyIn();
    }
}
