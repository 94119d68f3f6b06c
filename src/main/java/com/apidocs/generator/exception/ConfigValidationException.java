package com.apidocs.generator.exception;

import java.util.List;

/**
 * Single exception holding every invariant violation found in a run configuration.
 */
public class ConfigValidationException extends DocGenerationException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public ConfigValidationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
