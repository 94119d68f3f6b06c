package com.apidocs.generator.config;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every documented name of a run, mapped to its symbol handle, plus the alias map
 * that points duplicate names at the name they are documented under.
 *
 * Immutable once built.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class SymbolIndex {

    /**
     * Fully-qualified dotted name to opaque symbol handle.
     */
    private final Map<String, Object> symbols;

    /**
     * Alias name to canonical name.
     */
    @ToString.Include
    private final Map<String, String> duplicateOf;

    private final Map<String, List<String>> aliasesByCanonical;

    @Builder(toBuilder = true)
    public SymbolIndex(@NonNull @Singular Map<String, Object> symbols,
                       @NonNull @Singular("duplicate") Map<String, String> duplicateOf) {
        this.symbols = symbols;
        this.duplicateOf = duplicateOf;
        this.aliasesByCanonical = invert(duplicateOf);
    }

    private static Map<String, List<String>> invert(Map<String, String> duplicateOf) {
        Map<String, List<String>> result = new HashMap<>();
        duplicateOf.forEach((alias, canonical) ->
                result.computeIfAbsent(canonical, k -> new ArrayList<>()).add(alias));
        result.values().forEach(Collections::sort);
        result.replaceAll((k, v) -> List.copyOf(v));
        return Map.copyOf(result);
    }

    /**
     * The name a symbol is documented under. Resolves at most one alias hop.
     */
    public String canonicalName(String name) {
        return duplicateOf.getOrDefault(name, name);
    }

    public boolean isAlias(String name) {
        return duplicateOf.containsKey(name);
    }

    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    public Optional<Object> find(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * Other names documented as {@code canonicalName}, sorted. Never contains the canonical name itself.
     */
    public List<String> aliasesOf(String canonicalName) {
        return aliasesByCanonical.getOrDefault(canonicalName, List.of());
    }

    /**
     * All but the last component of a dotted name; empty for top-level names.
     */
    public static Optional<String> parentName(String fullName) {
        int dot = fullName.lastIndexOf('.');
        return dot < 0 ? Optional.empty() : Optional.of(fullName.substring(0, dot));
    }

    public static String shortName(String fullName) {
        return fullName.substring(fullName.lastIndexOf('.') + 1);
    }
}
