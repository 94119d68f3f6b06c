package com.apidocs.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One layer of partial application: values pre-bound to a callable before it is exposed.
 * Only the shape matters for signature computation, the values themselves are opaque.
 */
@Value
@Builder
public class PartialBinding {

    @NonNull
    @Singular("positional")
    List<Object> positionalValues;

    /**
     * Keyword bindings in the order they were supplied.
     */
    @NonNull
    @Singular("keyword")
    Map<String, Object> keywordValues;
}
