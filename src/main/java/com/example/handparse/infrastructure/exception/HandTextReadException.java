package com.example.handparse.infrastructure.exception;

/**
 * Signals that an uploaded hand history file could not be read.
 */
public class HandTextReadException extends InfrastructureException {
	/**
	 * @param message description shared with the application layer
	 * @param cause   underlying I/O failure
	 */
    public HandTextReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
