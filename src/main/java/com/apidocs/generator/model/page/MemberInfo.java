package com.apidocs.generator.model.page;

import com.apidocs.generator.model.DocstringSections;
import com.apidocs.generator.model.SymbolKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * A member listed on a class or module page.
 */
@Value
@Builder(toBuilder = true)
public class MemberInfo {

    @NonNull
    String shortName;

    @NonNull
    String fullName;

    /**
     * Handle borrowed from the symbol index.
     */
    @ToString.Exclude
    Object symbol;

    @NonNull
    SymbolKind kind;

    @NonNull
    @Builder.Default
    DocstringSections doc = DocstringSections.EMPTY;

    /**
     * Link to the member's own page, or null when the member has none.
     */
    String url;

    /**
     * Parameter list for callable members, or null.
     */
    String signature;

    public boolean isLinkable() {
        return url != null;
    }
}
