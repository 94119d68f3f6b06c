package com.apidocs.generator.exception;

/**
 * Base type of every failure raised while building documentation pages.
 */
public class DocGenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DocGenerationException(String message) {
        super(message);
    }

    public DocGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
