package com.example.handparse.domain.model;

import java.math.BigDecimal;

/**
 * One classified line of a hand body.
 *
 * @param name       actor name as written in the log
 * @param kind       canonical action kind
 * @param amount     chips or money involved, {@code null} when the line carries none
 * @param shownCards cards revealed by a {@link ActionKind#SHOW} line
 * @param seatNumber seat taken by a {@link ActionKind#JOIN} line
 * @param allIn      whether the line ended with {@code and is all-in}
 */
public record PlayerAction(
        String name,
        ActionKind kind,
        BigDecimal amount,
        Combo shownCards,
        Integer seatNumber,
        boolean allIn
) {

    public static PlayerAction of(String name, ActionKind kind) {
        return new PlayerAction(name, kind, null, null, null, false);
    }

    public static PlayerAction of(String name, ActionKind kind, BigDecimal amount) {
        return new PlayerAction(name, kind, amount, null, null, false);
    }

    public static PlayerAction allIn(String name, ActionKind kind, BigDecimal amount) {
        return new PlayerAction(name, kind, amount, null, null, true);
    }

    public static PlayerAction show(String name, Combo cards) {
        return new PlayerAction(name, ActionKind.SHOW, null, cards, null, false);
    }

    public static PlayerAction join(String name, int seatNumber) {
        return new PlayerAction(name, ActionKind.JOIN, null, null, seatNumber, false);
    }
}
