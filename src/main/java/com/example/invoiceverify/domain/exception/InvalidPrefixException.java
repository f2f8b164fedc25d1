package com.example.invoiceverify.domain.exception;

/**
 * Raised when a document prefix cannot be safely used to build artifact file names.
 */
public class InvalidPrefixException extends DomainException {

	/**
	 * Creates the exception with the rejected prefix.
	 *
	 * @param prefix caller supplied prefix
	 */
    public InvalidPrefixException(String prefix) {
        super("Invalid document prefix" + (prefix != null ? ": " + prefix : "."));
    }
}
