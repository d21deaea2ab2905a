package com.example.handparse.domain.exception;

import com.example.handparse.domain.model.ParseState;

/**
 * Raised when a hand history is read before the parse phase that produces the value has run,
 * e.g. asking for the seats of a hand whose header is the only thing parsed so far.
 */
public class HandNotParsedException extends DomainException {

	/**
	 * Creates the exception naming the current and the required phase.
	 *
	 * @param current  phase the hand history is in
	 * @param required phase the accessor needs
	 */
    public HandNotParsedException(ParseState current, ParseState required) {
        super("Hand history is " + current + " but " + required + " is required.");
    }
}
