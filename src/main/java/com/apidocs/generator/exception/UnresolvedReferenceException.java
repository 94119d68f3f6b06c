package com.apidocs.generator.exception;

/**
 * A {@code @{...}} token names a symbol or document absent from the configured indexes.
 */
public class UnresolvedReferenceException extends DocGenerationException {

    private static final long serialVersionUID = 1L;
    private final String reference;

    public UnresolvedReferenceException(String reference, String message) {
        super(message);
        this.reference = reference;
    }

    /**
     * The token body, without the surrounding {@code @{}} and {@code }}.
     */
    public String getReference() {
        return reference;
    }
}
