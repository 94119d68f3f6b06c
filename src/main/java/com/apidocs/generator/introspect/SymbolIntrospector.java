package com.apidocs.generator.introspect;

import com.apidocs.generator.model.CallableSignature;
import com.apidocs.generator.model.SourceLocation;
import com.apidocs.generator.model.SymbolKind;

import java.util.Optional;

/**
 * Capability queries the host environment answers about its symbol handles.
 *
 * Handles are opaque to the generator: it never inspects them beyond these calls.
 * Implementations must be side-effect free.
 */
public interface SymbolIntrospector {

    SymbolKind classify(Object symbol);

    /**
     * Docstring as written in source, or an empty string when there is none.
     */
    String rawDocstring(Object symbol);

    /**
     * Parameter list of a callable, including any partial bindings wrapped around it.
     * Empty for symbols that are not callable.
     */
    Optional<CallableSignature> declaredSignature(Object symbol);

    Optional<SourceLocation> definedIn(Object symbol);
}
