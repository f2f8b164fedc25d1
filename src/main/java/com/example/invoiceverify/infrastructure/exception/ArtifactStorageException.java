package com.example.invoiceverify.infrastructure.exception;

/**
 * Signals that an OCR page file or a per-document artifact could not be read or written.
 */
public class ArtifactStorageException extends InfrastructureException {

	/**
	 * @param message description of the artifact operation that failed
	 * @param cause   underlying IO or Jackson exception
	 */
    public ArtifactStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
