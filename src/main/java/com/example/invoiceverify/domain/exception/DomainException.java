package com.example.invoiceverify.domain.exception;

/**
 * Base type for invoice domain exceptions.
 * Subclasses describe document-level problems (bad prefix, missing inputs) in domain terms,
 * independent of how artifacts are stored or how the request arrived.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message which document rule was broken
	 */
    protected DomainException(String message) {
        super(message);
    }
}
