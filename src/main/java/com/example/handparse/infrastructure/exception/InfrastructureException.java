package com.example.handparse.infrastructure.exception;

/**
 * Base unchecked exception for infrastructure concerns such as reading uploaded files.
 * Keeps adapter failures isolated from the hand history vocabulary.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * Creates a new infrastructure exception while preserving the root cause.
	 *
	 * @param message context about the failure
	 * @param cause   exception bubbling up from lower level libraries
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
