package com.example.invoiceverify.domain.exception;

/**
 * Raised when a document stage is started without the per-document input files it needs.
 * The batch driver treats it as a skip: nothing is written for the document.
 */
public class DocumentInputMissingException extends DomainException {

	/**
	 * Creates the exception and names the document and the missing artifact.
	 *
	 * @param prefix   document identifier
	 * @param artifact description of the missing input
	 */
    public DocumentInputMissingException(String prefix, String artifact) {
        super("Required input not found for document '" + prefix + "': " + artifact);
    }
}
