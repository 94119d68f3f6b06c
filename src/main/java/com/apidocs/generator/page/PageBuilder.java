package com.apidocs.generator.page;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidocs.generator.argspec.ArgSpecResolver;
import com.apidocs.generator.argspec.SignatureFormatter;
import com.apidocs.generator.config.ParserConfig;
import com.apidocs.generator.config.SymbolIndex;
import com.apidocs.generator.exception.UnsupportedSymbolException;
import com.apidocs.generator.introspect.SymbolIntrospector;
import com.apidocs.generator.model.BuildDiagnostics;
import com.apidocs.generator.model.DocstringSections;
import com.apidocs.generator.model.SymbolKind;
import com.apidocs.generator.model.page.ClassPageInfo;
import com.apidocs.generator.model.page.FunctionPageInfo;
import com.apidocs.generator.model.page.MemberInfo;
import com.apidocs.generator.model.page.ModulePageInfo;
import com.apidocs.generator.model.page.PageInfo;
import com.apidocs.generator.parser.DocstringCleaner;
import com.apidocs.generator.parser.DocstringStructurer;
import com.apidocs.generator.reference.DocPaths;
import com.apidocs.generator.reference.ReferenceResolver;

/**
 * Assembles the page model of one symbol.
 *
 * Steps per page:
 * 1. Canonicalize the name and compute the relative path back to the API root
 * 2. Clean the docstring, resolve its references and structure it
 * 3. Collect members (classes and modules) or the signature (functions)
 *
 * Reference and signature errors propagate; missing or unclassifiable members
 * are recorded in {@link BuildDiagnostics} and skipped or filed as other members.
 */
public class PageBuilder {
    private static final Logger log = LoggerFactory.getLogger(PageBuilder.class);

    private final ParserConfig config;
    private final ReferenceResolver resolver;
    private final ArgSpecResolver argSpecResolver = new ArgSpecResolver();
    private final SignatureFormatter signatureFormatter;
    private final DocstringStructurer structurer = new DocstringStructurer();
    private final GuideLinkBuilder guideLinkBuilder;

    public PageBuilder(ParserConfig config, ReferenceResolver resolver) {
        this.config = config;
        this.resolver = resolver;
        this.signatureFormatter = new SignatureFormatter(config.getReceiverName(), config.getDefaultValueAliases());
        this.guideLinkBuilder = new GuideLinkBuilder(config);
    }

    public PageInfo buildPage(String fullName, Object symbol) {
        return buildPage(fullName, symbol, new BuildDiagnostics());
    }

    public PageInfo buildPage(String fullName, Object symbol, BuildDiagnostics diagnostics) {
        SymbolIndex index = config.getSymbolIndex();
        String master = index.canonicalName(fullName);
        String relativeRoot = DocPaths.relativePathToRoot(master);
        SymbolKind kind = introspector().classify(symbol);

        log.debug("Building {} page for {}", kind, master);

        return switch (kind) {
            case FUNCTION, PROPERTY -> buildFunctionPage(master, symbol, relativeRoot);
            case CLASS -> buildClassPage(master, symbol, relativeRoot, diagnostics);
            case MODULE -> buildModulePage(master, symbol, relativeRoot, diagnostics);
            case OTHER -> throw new UnsupportedSymbolException(master, kind);
        };
    }

    private FunctionPageInfo buildFunctionPage(String master, Object symbol, String relativeRoot) {
        boolean classMember = SymbolIndex.parentName(master).map(this::isIndexedClass).orElse(false);
        return FunctionPageInfo.builder()
                .fullName(master)
                .aliases(config.getSymbolIndex().aliasesOf(master))
                .definedIn(introspector().definedIn(symbol).orElse(null))
                .guides(guides(master, relativeRoot))
                .doc(structuredDoc(symbol, relativeRoot))
                .signature(signatureOf(symbol, classMember).orElse(""))
                .build();
    }

    private ClassPageInfo buildClassPage(String master, Object symbol, String relativeRoot,
                                         BuildDiagnostics diagnostics) {
        ClassPageInfo.ClassPageInfoBuilder page = ClassPageInfo.builder()
                .fullName(master)
                .aliases(config.getSymbolIndex().aliasesOf(master))
                .definedIn(introspector().definedIn(symbol).orElse(null))
                .guides(guides(master, relativeRoot))
                .doc(structuredDoc(symbol, relativeRoot));

        for (String shortName : config.childrenOf(master)) {
            if (config.getExcludedClassMembers().contains(shortName)) {
                continue;
            }
            String childName = master + "." + shortName;
            Optional<Object> child = config.getSymbolIndex().find(childName);
            if (child.isEmpty()) {
                diagnostics.warn("Member " + childName + " is listed in the name tree but not indexed; skipped");
                continue;
            }

            Object childSymbol = child.get();
            SymbolKind childKind = introspector().classify(childSymbol);
            DocstringSections childDoc = structuredDoc(childSymbol, relativeRoot);
            MemberInfo.MemberInfoBuilder member = MemberInfo.builder()
                    .shortName(shortName)
                    .fullName(childName)
                    .symbol(childSymbol)
                    .kind(childKind)
                    .doc(childDoc);

            switch (childKind) {
                case PROPERTY -> page.property(member.build());
                case CLASS -> page.childClass(member.url(resolver.referenceToUrl(childName, relativeRoot)).build());
                case FUNCTION -> {
                    if (config.getTrivialMethods().contains(shortName) && childDoc.getBrief().isBlank()) {
                        log.debug("Skipping undocumented trivial method {}", childName);
                        continue;
                    }
                    page.method(member.signature(signatureOf(childSymbol, true).orElse("()")).build());
                }
                default -> {
                    diagnostics.info("Member " + childName + " of kind " + childKind + " filed under class members");
                    page.otherMember(member.build());
                }
            }
        }
        return page.build();
    }

    private ModulePageInfo buildModulePage(String master, Object symbol, String relativeRoot,
                                           BuildDiagnostics diagnostics) {
        List<MemberInfo> members = new ArrayList<>();
        for (String shortName : config.childrenOf(master)) {
            if (config.getExcludedModuleMembers().contains(shortName)) {
                continue;
            }
            String childName = master + "." + shortName;
            Optional<Object> child = config.getSymbolIndex().find(childName);
            if (child.isEmpty()) {
                diagnostics.warn("Member " + childName + " is listed in the name tree but not indexed; skipped");
                continue;
            }

            Object childSymbol = child.get();
            SymbolKind childKind = introspector().classify(childSymbol);
            members.add(MemberInfo.builder()
                    .shortName(shortName)
                    .fullName(childName)
                    .symbol(childSymbol)
                    .kind(childKind)
                    .doc(structuredDoc(childSymbol, relativeRoot))
                    .url(childKind.isLinkable() ? resolver.referenceToUrl(childName, relativeRoot) : null)
                    .build());
        }

        return ModulePageInfo.builder()
                .fullName(master)
                .aliases(config.getSymbolIndex().aliasesOf(master))
                .definedIn(introspector().definedIn(symbol).orElse(null))
                .guides(guides(master, relativeRoot))
                .doc(structuredDoc(symbol, relativeRoot))
                .members(members)
                .build();
    }

    private DocstringSections structuredDoc(Object symbol, String relativeRoot) {
        String cleaned = DocstringCleaner.clean(introspector().rawDocstring(symbol));
        String resolved = resolver.replaceReferences(cleaned, relativeRoot);
        return structurer.structure(DocstringCleaner.stripSymbolMarkers(resolved));
    }

    private Optional<String> signatureOf(Object symbol, boolean classMember) {
        return introspector().declaredSignature(symbol)
                .map(argSpecResolver::resolve)
                .map(spec -> signatureFormatter.format(spec, classMember));
    }

    private String guides(String master, String relativeRoot) {
        List<String> names = new ArrayList<>();
        names.add(master);
        names.addAll(config.getSymbolIndex().aliasesOf(master));
        return guideLinkBuilder.build(names, relativeRoot);
    }

    private boolean isIndexedClass(String name) {
        return config.getSymbolIndex().find(name)
                .map(s -> introspector().classify(s) == SymbolKind.CLASS)
                .orElse(false);
    }

    private SymbolIntrospector introspector() {
        return config.getIntrospector();
    }
}
