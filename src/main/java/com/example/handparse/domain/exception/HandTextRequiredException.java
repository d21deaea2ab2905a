package com.example.handparse.domain.exception;

/**
 * Raised when a parse is requested without any hand history text.
 * Guards the parser from null or blank input before any section splitting happens.
 */
public class HandTextRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public HandTextRequiredException() {
        super("Please supply the text of a hand history.");
    }
}
