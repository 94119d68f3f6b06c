package com.apidocs.generator.model.page;

import com.apidocs.generator.model.DocstringSections;
import com.apidocs.generator.model.SourceLocation;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Page for a function or a top-level property.
 */
@Getter
@ToString(callSuper = true)
public class FunctionPageInfo extends PageInfo {
    /**
     * Parenthesized parameter list, e.g. {@code (x, name=None)}.
     */
    private final String signature;

    @Builder
    public FunctionPageInfo(String fullName, List<String> aliases, SourceLocation definedIn,
                            String guides, DocstringSections doc, String signature) {
        super(fullName, aliases, definedIn, guides, doc);
        this.signature = signature != null ? signature : "";
    }

    @Override
    public <R> R accept(PageInfoVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
