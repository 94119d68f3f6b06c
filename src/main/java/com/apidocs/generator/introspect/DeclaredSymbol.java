package com.apidocs.generator.introspect;

import com.apidocs.generator.model.CallableSignature;
import com.apidocs.generator.model.SourceLocation;
import com.apidocs.generator.model.SymbolKind;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Symbol handle carrying its own introspection answers, for hosts that collect
 * symbols ahead of time.
 *
 * Equality is identity, like the live objects these handles stand in for.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class DeclaredSymbol {

    @NonNull
    private final SymbolKind kind;

    @NonNull
    @Builder.Default
    private final String docstring = "";

    /**
     * Parameter list for callables, null otherwise.
     */
    private final CallableSignature signature;

    private final SourceLocation definedIn;

    public static DeclaredSymbol module(String docstring) {
        return DeclaredSymbol.builder().kind(SymbolKind.MODULE).docstring(docstring).build();
    }

    public static DeclaredSymbol ofClass(String docstring) {
        return DeclaredSymbol.builder().kind(SymbolKind.CLASS).docstring(docstring).build();
    }

    public static DeclaredSymbol function(String docstring, CallableSignature signature) {
        return DeclaredSymbol.builder().kind(SymbolKind.FUNCTION).docstring(docstring).signature(signature).build();
    }

    public static DeclaredSymbol property(String docstring) {
        return DeclaredSymbol.builder().kind(SymbolKind.PROPERTY).docstring(docstring).build();
    }

    public static DeclaredSymbol constant() {
        return DeclaredSymbol.builder().kind(SymbolKind.OTHER).build();
    }
}
