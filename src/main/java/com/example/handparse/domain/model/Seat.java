package com.example.handparse.domain.model;

import java.math.BigDecimal;

/**
 * One seat at the table. Unoccupied seats are explicit placeholders so that
 * the seat list of a hand always has one entry per table position.
 */
public record Seat(
        int seatNumber,
        String name,
        BigDecimal stack,
        Combo holeCards,
        boolean occupied,
        boolean sittingOut
) {

    public static Seat occupied(int seatNumber, String name, BigDecimal stack, boolean sittingOut) {
        return new Seat(seatNumber, name, stack, null, true, sittingOut);
    }

    public static Seat empty(int seatNumber) {
        return new Seat(seatNumber, "Empty Seat " + seatNumber, BigDecimal.ZERO, null, false, false);
    }

    public Seat withHoleCards(Combo combo) {
        return new Seat(seatNumber, name, stack, combo, occupied, sittingOut);
    }
}
