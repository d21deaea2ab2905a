package com.example.handparse.domain.model;

import java.math.BigDecimal;

/**
 * Tournament context of a hand. Buy-in and rake are zero for freerolls.
 */
public record TournamentInfo(
        String tournamentId,
        String level,
        BigDecimal buyIn,
        BigDecimal rake,
        boolean freeroll
) {
}
