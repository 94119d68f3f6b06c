package com.apidocs.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A keyword-headed section of a docstring, such as {@code Args:} or {@code Returns:}.
 */
@Value
@Builder
public class FunctionDetail {

    /**
     * Section keyword without the colon (e.g., "Args").
     */
    @NonNull
    String keyword;

    /**
     * Free text between the keyword line and the first item.
     */
    @NonNull
    @Builder.Default
    String header = "";

    /**
     * Indentation shared by every item line of this section.
     */
    @NonNull
    @Builder.Default
    String itemIndent = "";

    @NonNull
    @Singular("item")
    List<DetailItem> items;

    /**
     * Reproduces the section exactly as it appeared in the docstring.
     */
    public String serialize() {
        StringBuilder sb = new StringBuilder();
        sb.append(keyword).append(":\n");
        sb.append(header);
        for (DetailItem item : items) {
            sb.append(itemIndent).append(item.getName()).append(':').append(item.getDescription());
        }
        return sb.toString();
    }
}
