package com.apidocs.generator.config;

import com.apidocs.generator.introspect.SymbolIntrospector;
import com.apidocs.generator.model.DocumentInfo;
import com.apidocs.generator.model.GuideReference;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Run-scoped configuration shared by every page of one generation run.
 *
 * Built once by the collector, read-only afterwards. Passed explicitly to every
 * component that needs it.
 */
@Value
@Builder(toBuilder = true)
public class ParserConfig {

    public static final Set<String> DEFAULT_EXCLUDED_CLASS_MEMBERS = Set.of(
            "__class__", "__base__", "__weakref__", "__doc__", "__module__",
            "__dict__", "__abstractmethods__", "__slots__", "__getnewargs__");

    public static final Set<String> DEFAULT_EXCLUDED_MODULE_MEMBERS = Set.of(
            "__builtins__", "__doc__", "__file__", "__name__", "__path__", "__package__");

    public static final Set<String> DEFAULT_TRIVIAL_METHODS = Set.of(
            "__str__", "__repr__", "__hash__", "__del__", "__copy__");

    @NonNull
    SymbolIndex symbolIndex;

    /**
     * Parent full name to ordered child short names. The empty name holds top-level symbols.
     */
    @NonNull
    @Singular("children")
    Map<String, List<String>> tree;

    /**
     * Targets of {@code @{$id}} references.
     */
    @NonNull
    @Singular("document")
    Map<String, DocumentInfo> docIndex;

    /**
     * Guides mentioning a symbol, keyed by any of its names.
     */
    @NonNull
    @Singular("guides")
    Map<String, List<GuideReference>> guideIndex;

    /**
     * Default-value source text (or a dotted prefix of it) to the public name it should render as.
     */
    @NonNull
    @Singular
    Map<String, String> defaultValueAliases;

    /**
     * Root module names symbol references must start with. Empty accepts any name.
     */
    @NonNull
    @Singular
    Set<String> moduleNames;

    @NonNull
    SymbolIntrospector introspector;

    /**
     * Leading parameter dropped from the signatures of class members.
     */
    @NonNull
    @Builder.Default
    String receiverName = "self";

    @NonNull
    @Builder.Default
    Set<String> excludedClassMembers = DEFAULT_EXCLUDED_CLASS_MEMBERS;

    @NonNull
    @Builder.Default
    Set<String> excludedModuleMembers = DEFAULT_EXCLUDED_MODULE_MEMBERS;

    /**
     * Methods left out of class pages when they carry no docstring.
     */
    @NonNull
    @Builder.Default
    Set<String> trivialMethods = DEFAULT_TRIVIAL_METHODS;

    public List<String> childrenOf(String fullName) {
        return tree.getOrDefault(fullName, List.of());
    }
}
