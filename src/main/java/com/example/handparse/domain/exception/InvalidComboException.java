package com.example.handparse.domain.exception;

/**
 * Raised when a set of hole or shown cards breaks the combo invariants:
 * a duplicate card, or a card count other than two or four.
 */
public class InvalidComboException extends DomainException {

	/**
	 * Creates the exception for the given card notation.
	 *
	 * @param cards  card notation as it appeared in the log
	 * @param reason which invariant failed
	 */
    public InvalidComboException(String cards, String reason) {
        super("Invalid combo [" + cards + "]: " + reason);
    }
}
