package com.apidocs.generator.model;

/**
 * Where a symbol's definition comes from.
 */
public enum SourceKind {
    SOURCE,
    GENERATED,
    BUILTIN
}
