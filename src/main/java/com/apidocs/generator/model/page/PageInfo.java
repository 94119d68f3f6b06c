package com.apidocs.generator.model.page;

import com.apidocs.generator.model.DocstringSections;
import com.apidocs.generator.model.SourceLocation;

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * Renderer-ready model of one documentation page.
 *
 * The set of page kinds is closed: subclasses live in this package only.
 */
@Getter
@ToString
public abstract class PageInfo {
    protected final String fullName;
    protected final List<String> aliases;
    @ToString.Exclude
    protected final SourceLocation definedIn;
    protected final String guides;
    protected final DocstringSections doc;

    PageInfo(String fullName, List<String> aliases, SourceLocation definedIn,
             String guides, DocstringSections doc) {
        this.fullName = fullName;
        this.aliases = aliases != null ? List.copyOf(aliases) : List.of();
        this.definedIn = definedIn;
        this.guides = guides != null ? guides : "";
        this.doc = doc != null ? doc : DocstringSections.EMPTY;
    }

    public abstract <R> R accept(PageInfoVisitor<R> visitor);

    public Optional<SourceLocation> findDefinedIn() {
        return Optional.ofNullable(definedIn);
    }
}
