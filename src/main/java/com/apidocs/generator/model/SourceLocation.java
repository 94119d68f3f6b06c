package com.apidocs.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Definition site of a symbol, supplied by the host. Opaque to everything but the renderer.
 */
@Value
@Builder
public class SourceLocation {

    /**
     * Path relative to the code base root. May be null for built-ins.
     */
    String path;

    /**
     * Browsable location of {@link #path}, or null when none is known.
     */
    String url;

    @NonNull
    @Builder.Default
    SourceKind kind = SourceKind.SOURCE;

    public static SourceLocation of(String path) {
        return SourceLocation.builder().path(path).build();
    }
}
