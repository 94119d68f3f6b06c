package com.apidocs.generator.model;

/**
 * Classification of a documented symbol, as reported by the host introspector.
 */
public enum SymbolKind {
    /**
     * A namespace holding other symbols.
     */
    MODULE,

    /**
     * A class (top-level or nested).
     */
    CLASS,

    /**
     * A function, method or other routine.
     */
    FUNCTION,

    /**
     * A computed attribute of a class.
     */
    PROPERTY,

    /**
     * Anything else: constants, plain data members, unknown objects.
     */
    OTHER;

    /**
     * Whether symbols of this kind get a page of their own when listed in a module.
     */
    public boolean isLinkable() {
        return this == MODULE || this == CLASS || this == FUNCTION;
    }
}
