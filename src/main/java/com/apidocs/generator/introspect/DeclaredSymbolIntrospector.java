package com.apidocs.generator.introspect;

import com.apidocs.generator.model.CallableSignature;
import com.apidocs.generator.model.SourceLocation;
import com.apidocs.generator.model.SymbolKind;

import java.util.Optional;

/**
 * Introspector for {@link DeclaredSymbol} handles. Any other handle is classified
 * as {@link SymbolKind#OTHER} with no docstring.
 */
public class DeclaredSymbolIntrospector implements SymbolIntrospector {

    @Override
    public SymbolKind classify(Object symbol) {
        if (symbol instanceof DeclaredSymbol declared) {
            return declared.getKind();
        }
        return SymbolKind.OTHER;
    }

    @Override
    public String rawDocstring(Object symbol) {
        if (symbol instanceof DeclaredSymbol declared) {
            return declared.getDocstring();
        }
        return "";
    }

    @Override
    public Optional<CallableSignature> declaredSignature(Object symbol) {
        if (symbol instanceof DeclaredSymbol declared) {
            return Optional.ofNullable(declared.getSignature());
        }
        return Optional.empty();
    }

    @Override
    public Optional<SourceLocation> definedIn(Object symbol) {
        if (symbol instanceof DeclaredSymbol declared) {
            return Optional.ofNullable(declared.getDefinedIn());
        }
        return Optional.empty();
    }
}
