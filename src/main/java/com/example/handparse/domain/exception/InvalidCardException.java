package com.example.handparse.domain.exception;

/**
 * Raised when a card token such as {@code "As"} or {@code "Td"} cannot be read.
 */
public class InvalidCardException extends DomainException {

	/**
	 * Creates the exception and records the offending token.
	 *
	 * @param token raw card notation
	 */
    public InvalidCardException(String token) {
        super("Invalid card: " + token);
    }
}
