package com.example.handparse.domain.model;

/**
 * Whether a hand was dealt at a cash table or inside a tournament.
 */
public enum GameType {
    CASH,
    TOURNAMENT
}
