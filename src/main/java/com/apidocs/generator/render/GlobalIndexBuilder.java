package com.apidocs.generator.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidocs.generator.config.ParserConfig;
import com.apidocs.generator.config.SymbolIndex;
import com.apidocs.generator.model.SymbolKind;
import com.apidocs.generator.reference.ReferenceResolver;

/**
 * Builds the flat, alphabetical listing of every module, class and function of a library.
 *
 * Duplicate names are listed under their own name and link to the canonical page.
 * Methods are left out: they are reached through their class page.
 */
public class GlobalIndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(GlobalIndexBuilder.class);

    private final ParserConfig config;
    private final ReferenceResolver resolver;

    public GlobalIndexBuilder(ParserConfig config, ReferenceResolver resolver) {
        this.config = config;
        this.resolver = resolver;
    }

    public String build(String libraryName) {
        SymbolIndex index = config.getSymbolIndex();
        Map<String, String> links = new TreeMap<>();

        index.getSymbols().forEach((fullName, symbol) -> {
            SymbolKind kind = config.getIntrospector().classify(symbol);
            if (!kind.isLinkable()) {
                return;
            }
            if (kind == SymbolKind.FUNCTION && isClassMember(fullName)) {
                return;
            }
            links.put(fullName, resolver.symbolLink(fullName, fullName, ".", true));
        });

        log.debug("Global index of {} lists {} symbols", libraryName, links.size());

        List<String> lines = new ArrayList<>();
        lines.add("# All symbols in " + libraryName);
        lines.add("");
        links.values().forEach(link -> lines.add("*  " + link));
        return String.join("\n", lines);
    }

    private boolean isClassMember(String fullName) {
        return SymbolIndex.parentName(fullName)
                .flatMap(parent -> config.getSymbolIndex().find(parent))
                .map(parent -> config.getIntrospector().classify(parent) == SymbolKind.CLASS)
                .orElse(false);
    }
}
