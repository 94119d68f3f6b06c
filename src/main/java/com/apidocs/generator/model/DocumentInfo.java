package com.apidocs.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Entry of the document index, target of {@code @{$id}} references.
 */
@Value
public class DocumentInfo {
    @NonNull
    String title;

    /**
     * Location relative to the documentation root.
     */
    @NonNull
    String url;
}
