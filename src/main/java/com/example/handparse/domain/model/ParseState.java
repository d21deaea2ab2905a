package com.example.handparse.domain.model;

/**
 * Phases of a hand history parse. Header-only callers stop at {@link #HEADER_PARSED}
 * and never pay for the body.
 */
public enum ParseState {
    UNPARSED,
    HEADER_PARSED,
    FULLY_PARSED;

    public boolean reached(ParseState required) {
        return compareTo(required) >= 0;
    }
}
