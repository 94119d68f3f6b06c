package com.apidocs.generator;

import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidocs.generator.config.ParserConfig;
import com.apidocs.generator.config.ParserConfigValidator;
import com.apidocs.generator.config.SymbolIndex;
import com.apidocs.generator.exception.ConfigValidationException;
import com.apidocs.generator.exception.DocGenerationException;
import com.apidocs.generator.model.BuildDiagnostics;
import com.apidocs.generator.model.SymbolKind;
import com.apidocs.generator.model.page.PageInfo;
import com.apidocs.generator.page.PageBuilder;
import com.apidocs.generator.reference.DocPaths;
import com.apidocs.generator.reference.ReferenceResolver;
import com.apidocs.generator.render.GlobalIndexBuilder;
import com.apidocs.generator.render.MarkdownRenderer;

/**
 * Renders the pages of every documented symbol of a run.
 *
 * Pages are built independently: a symbol whose page fails is reported in
 * {@link GeneratorResult#getFailures()} and does not stop the run. Nothing is
 * written to disk; callers own the output.
 */
public class ApiDocsGenerator {
    private static final Logger log = LoggerFactory.getLogger(ApiDocsGenerator.class);

    private final ParserConfig config;
    private final ReferenceResolver resolver;
    private final PageBuilder pageBuilder;
    private final MarkdownRenderer renderer = new MarkdownRenderer();
    private final GlobalIndexBuilder globalIndexBuilder;

    public ApiDocsGenerator(ParserConfig config) {
        this.config = config;
        this.resolver = new ReferenceResolver(config);
        this.pageBuilder = new PageBuilder(config, resolver);
        this.globalIndexBuilder = new GlobalIndexBuilder(config, resolver);
    }

    public GeneratorResult generate(String libraryName) {
        try {
            new ParserConfigValidator().validate(config);
        } catch (ConfigValidationException e) {
            log.error("Invalid configuration: {}", e.getErrors());
            return GeneratorResult.failure(e.getMessage());
        }

        SymbolIndex index = config.getSymbolIndex();
        Map<String, String> pages = new TreeMap<>();
        Map<String, String> failures = new TreeMap<>();
        BuildDiagnostics diagnostics = new BuildDiagnostics();

        log.info("Generating pages for {} ({} indexed names)", libraryName, index.getSymbols().size());

        for (Map.Entry<String, Object> entry : new TreeMap<>(index.getSymbols()).entrySet()) {
            String fullName = entry.getKey();
            Object symbol = entry.getValue();
            if (index.isAlias(fullName) || !hasOwnPage(fullName, symbol)) {
                continue;
            }
            try {
                PageInfo page = pageBuilder.buildPage(fullName, symbol, diagnostics);
                pages.put(DocPaths.documentationPath(fullName), renderer.render(page));
            } catch (DocGenerationException e) {
                log.warn("Skipping page for {}: {}", fullName, e.getMessage());
                failures.put(fullName, e.getMessage());
            }
        }

        if (diagnostics.hasWarnings()) {
            log.warn("{} member(s) skipped while building pages", diagnostics.getWarnings().size());
            diagnostics.getWarnings().forEach(w -> log.warn(w));
        }
        diagnostics.getInfos().forEach(i -> log.debug(i));

        String globalIndex = globalIndexBuilder.build(libraryName);
        log.info("Generated {} pages, {} failures", pages.size(), failures.size());

        return GeneratorResult.builder()
                .success(failures.isEmpty())
                .errorMessage(failures.isEmpty() ? null : failures.size() + " page(s) could not be generated")
                .pages(pages)
                .failures(failures)
                .warnings(diagnostics.getWarnings())
                .globalIndex(globalIndex)
                .build();
    }

    /**
     * Modules, classes and free functions get pages; methods appear on their class page.
     */
    private boolean hasOwnPage(String fullName, Object symbol) {
        SymbolKind kind = config.getIntrospector().classify(symbol);
        if (!kind.isLinkable()) {
            return false;
        }
        if (kind != SymbolKind.FUNCTION) {
            return true;
        }
        return SymbolIndex.parentName(fullName)
                .flatMap(config.getSymbolIndex()::find)
                .map(parent -> config.getIntrospector().classify(parent) != SymbolKind.CLASS)
                .orElse(true);
    }
}
