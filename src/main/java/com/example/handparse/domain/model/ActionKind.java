package com.example.handparse.domain.model;

import java.util.Locale;

/**
 * Closed set of events a hand history body can record.
 */
public enum ActionKind {
    FOLD,
    CHECK,
    CALL,
    BET,
    RAISE,
    POST,
    RETURN,
    WIN,
    SHOW,
    MUCK,
    JOIN,
    LEAVE,
    TIMED_OUT,
    CONNECTED,
    DISCONNECTED,
    REMOVED;

	/**
	 * Maps the verb of a {@code name: verb ...} line onto the canonical vocabulary.
	 *
	 * @param verb first word after the colon, e.g. {@code "raises"}
	 * @return action kind or {@code null} when the verb is not a betting action
	 */
    public static ActionKind fromVerb(String verb) {
        if (verb == null) {
            return null;
        }
        return switch (verb.toLowerCase(Locale.ROOT)) {
            case "fold", "folds", "folded" -> FOLD;
            case "check", "checks" -> CHECK;
            case "call", "calls" -> CALL;
            case "bet", "bets" -> BET;
            case "raise", "raises" -> RAISE;
            case "post", "posts" -> POST;
            case "muck", "mucks" -> MUCK;
            default -> null;
        };
    }
}
