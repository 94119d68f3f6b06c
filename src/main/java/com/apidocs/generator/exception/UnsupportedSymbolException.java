package com.apidocs.generator.exception;

import com.apidocs.generator.model.SymbolKind;

/**
 * A page was requested for a symbol kind that has no page layout.
 */
public class UnsupportedSymbolException extends DocGenerationException {

    private static final long serialVersionUID = 1L;
    private final String fullName;
    private final SymbolKind kind;

    public UnsupportedSymbolException(String fullName, SymbolKind kind) {
        super("Cannot make docs for " + fullName + ": symbols of kind " + kind + " have no page");
        this.fullName = fullName;
        this.kind = kind;
    }

    public String getFullName() {
        return fullName;
    }

    public SymbolKind getKind() {
        return kind;
    }
}
