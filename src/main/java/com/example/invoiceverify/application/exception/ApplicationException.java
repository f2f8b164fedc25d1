package com.example.invoiceverify.application.exception;

/**
 * Base unchecked exception for failures raised by the invoice processing use cases.
 * Keeps request validation separate from domain rules and from storage failures.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * Creates a new application-layer exception with the provided message.
	 *
	 * @param message error description that can be shown to the API caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }
}
