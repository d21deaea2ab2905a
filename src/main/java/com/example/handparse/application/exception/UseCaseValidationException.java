package com.example.handparse.application.exception;

/**
 * Signals that a hand history request is invalid as a whole, for example a batch text in which
 * no hand header can be found.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
