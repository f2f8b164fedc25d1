package com.example.invoiceverify.infrastructure.exception;

/**
 * Base unchecked exception for infrastructure concerns such as file IO and JSON mapping.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * Creates a new infrastructure exception while preserving the root cause.
	 *
	 * @param message context about the failure
	 * @param cause   exception raised by the JDK or Jackson
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
