package com.example.handparse.application.exception;

/**
 * Base unchecked exception for failures in the application layer.
 * Raised by use cases that reject a request before or around parsing, never by the parser itself.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * Creates a new application-layer exception with the provided message.
	 *
	 * @param message human readable error description suitable for surfacing to the caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }
}
