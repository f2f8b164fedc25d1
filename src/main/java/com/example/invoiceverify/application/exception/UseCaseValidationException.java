package com.example.invoiceverify.application.exception;

/**
 * Signals a request that a use case cannot act on, such as an unknown amount field name.
 * Mapped to HTTP 400 by the API layer.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
