package com.apidocs.generator;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * Result of one documentation generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;

    /**
     * Documentation path (e.g. {@code a/b/C.md}) to rendered markdown, sorted by path.
     */
    @Singular
    private Map<String, String> pages;

    /**
     * Full name to failure message for symbols whose page could not be built.
     */
    @Singular
    private Map<String, String> failures;

    @Singular
    private List<String> warnings;

    private String globalIndex;

    public int getPagesGenerated() {
        return pages.size();
    }

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
