package com.apidocs.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A docstring split into its brief, remaining body text, detail sections and
 * compatibility notes.
 *
 * Without compatibility blocks, {@code docstring} followed by every detail's
 * {@link FunctionDetail#serialize()} reproduces the original text.
 */
@Value
@Builder
public class DocstringSections {

    public static final DocstringSections EMPTY = DocstringSections.builder().build();

    /**
     * First line of the body text.
     */
    @NonNull
    @Builder.Default
    String brief = "";

    /**
     * Body text with detail sections and compatibility blocks removed.
     */
    @NonNull
    @Builder.Default
    String docstring = "";

    @NonNull
    @Singular("detail")
    List<FunctionDetail> details;

    /**
     * Compatibility notes keyed by target, in order of appearance.
     */
    @NonNull
    @Singular("compatibilityNote")
    Map<String, String> compatibility;

    /**
     * Concatenation of body text and serialized detail sections.
     */
    public String reassemble() {
        StringBuilder sb = new StringBuilder(docstring);
        details.forEach(d -> sb.append(d.serialize()));
        return sb.toString();
    }
}
