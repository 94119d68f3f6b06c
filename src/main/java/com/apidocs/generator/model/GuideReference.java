package com.apidocs.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A narrative guide that mentions a symbol.
 */
@Value
@Builder
public class GuideReference {

    @NonNull
    String title;

    /**
     * Location relative to the documentation root, optionally with a {@code #section} anchor.
     */
    @NonNull
    String url;

    /**
     * Title of the section mentioning the symbol, or null when the whole guide is meant.
     */
    String sectionTitle;

    public String getLinkText() {
        return sectionTitle == null ? title : title + " > " + sectionTitle;
    }
}
