package com.example.handparse.domain.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Fully parsed hand. Absent sections are {@code null}; action lists are never {@code null}
 * except {@code showDownActions}, which exists only when the hand went to showdown.
 */
public record Hand(
        HandHeader header,
        String tableName,
        int maxPlayers,
        Seat button,
        Seat hero,
        List<Seat> players,
        List<PlayerAction> preflopActions,
        Street flop,
        Street turn,
        Street river,
        boolean showDown,
        List<PlayerAction> showDownActions,
        BigDecimal totalPot,
        BigDecimal rake,
        List<Card> board,
        Set<String> winners
) {

    public String handId() {
        return header.handId();
    }

    public List<PlayerAction> flopActions() {
        return flop == null ? null : flop.actions();
    }

    public List<PlayerAction> turnActions() {
        return turn == null ? null : turn.actions();
    }

    public List<PlayerAction> riverActions() {
        return river == null ? null : river.actions();
    }

    public Card turnCard() {
        return turn == null ? null : turn.cards().get(0);
    }

    public Card riverCard() {
        return river == null ? null : river.cards().get(0);
    }
}
