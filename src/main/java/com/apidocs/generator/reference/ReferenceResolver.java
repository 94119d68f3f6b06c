package com.apidocs.generator.reference;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidocs.generator.config.ParserConfig;
import com.apidocs.generator.config.SymbolIndex;
import com.apidocs.generator.exception.UnresolvedReferenceException;
import com.apidocs.generator.model.DocumentInfo;
import com.apidocs.generator.model.SymbolKind;

/**
 * Rewrites {@code @{...}} tokens into markdown links.
 *
 * Two namespaces:
 * - {@code @{a.b.C}} links to the page of a symbol (or to an anchor on its parent's page)
 * - {@code @{$doc#anchor}} links to an external document from the document index
 *
 * Either form may end in {@code $text} to replace the default link text.
 * Stateless apart from the run configuration: safe to share.
 */
public class ReferenceResolver {
    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private static final Pattern REFERENCE = Pattern.compile("@\\{([^}]+)\\}");

    /**
     * API pages live two directories below the documentation root.
     */
    private static final String DOCS_ROOT_FROM_API_ROOT = "../..";

    private final ParserConfig config;

    public ReferenceResolver(ParserConfig config) {
        this.config = config;
    }

    /**
     * Replaces every token of {@code text}. Text outside tokens passes through unchanged.
     *
     * @param relativeRoot path from the current page to the API root, e.g. {@code ../..}
     * @throws UnresolvedReferenceException on the first token that does not resolve
     */
    public String replaceReferences(String text, String relativeRoot) {
        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String link = resolveReference(matcher.group(1), relativeRoot);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(link));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Resolves one token body (the text between {@code @{} and {@code }}).
     */
    public String resolveReference(String reference, String relativeRoot) {
        String target = reference;
        String manualText = null;
        int dollar = reference.lastIndexOf('$');
        if (dollar > 0) {
            target = reference.substring(0, dollar);
            manualText = reference.substring(dollar + 1);
        }

        if (target.startsWith("$")) {
            return documentLink(reference, target.substring(1), manualText, relativeRoot);
        }

        if (!isInDocumentedModule(target)) {
            throw new UnresolvedReferenceException(reference,
                    "Reference @{" + reference + "} is outside the documented modules " + config.getModuleNames());
        }
        if (manualText != null) {
            return symbolLink(manualText, target, relativeRoot, false);
        }
        return symbolLink(target, target, relativeRoot, true);
    }

    /**
     * Markdown link to the page of {@code name}. Code references quote the text in backticks.
     */
    public String symbolLink(String text, String name, String relativeRoot, boolean codeRef) {
        String url = referenceToUrl(name, relativeRoot);
        return codeRef ? "[`" + text + "`](" + url + ")" : "[" + text + "](" + url + ")";
    }

    /**
     * Relative URL of the page documenting {@code name}, with an anchor when the name is
     * a member shown on its parent's page.
     */
    public String referenceToUrl(String name, String relativeRoot) {
        SymbolIndex index = config.getSymbolIndex();
        String master = index.canonicalName(name);
        Optional<String> parent = SymbolIndex.parentName(master);
        String shortName = SymbolIndex.shortName(master);

        if (index.contains(master)) {
            SymbolKind kind = classify(master);
            if (kind != SymbolKind.CLASS && kind != SymbolKind.MODULE
                    && parent.isPresent() && isIndexedClass(parent.get())) {
                return anchorOnParent(parent.get(), shortName, relativeRoot);
            }
            return DocPaths.join(relativeRoot, DocPaths.documentationPath(master));
        }

        if (parent.isPresent() && index.contains(parent.get())) {
            log.debug("{} is not indexed, linking to an anchor on {}", master, parent.get());
            return anchorOnParent(parent.get(), shortName, relativeRoot);
        }

        throw new UnresolvedReferenceException(name, "Cannot make link to \"" + name + "\": not in the symbol index");
    }

    /**
     * Anchor on the page of {@code parent}. The page lives under the parent's canonical name.
     */
    private String anchorOnParent(String parent, String shortName, String relativeRoot) {
        String parentPage = DocPaths.documentationPath(config.getSymbolIndex().canonicalName(parent));
        return DocPaths.join(relativeRoot, parentPage + "#" + shortName);
    }

    private String documentLink(String reference, String target, String manualText, String relativeRoot) {
        String id = target;
        String hash = "";
        int hashIndex = target.indexOf('#');
        if (hashIndex >= 0) {
            id = target.substring(0, hashIndex);
            hash = target.substring(hashIndex);
        }

        DocumentInfo document = config.getDocIndex().get(id);
        if (document == null) {
            throw new UnresolvedReferenceException(reference,
                    "Cannot make link to document \"" + id + "\": not in the document index");
        }

        String text = manualText != null ? manualText : document.getTitle();
        String url = DocPaths.normalize(
                DocPaths.join(DocPaths.join(relativeRoot, DOCS_ROOT_FROM_API_ROOT), document.getUrl()));
        return "[" + text + "](" + url + hash + ")";
    }

    private boolean isInDocumentedModule(String name) {
        if (config.getModuleNames().isEmpty()) {
            return true;
        }
        return config.getModuleNames().stream()
                .anyMatch(module -> name.equals(module) || name.startsWith(module + "."));
    }

    private boolean isIndexedClass(String name) {
        return config.getSymbolIndex().contains(name) && classify(name) == SymbolKind.CLASS;
    }

    private SymbolKind classify(String name) {
        return config.getSymbolIndex().find(name)
                .map(symbol -> config.getIntrospector().classify(symbol))
                .orElse(SymbolKind.OTHER);
    }
}
