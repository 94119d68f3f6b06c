package com.apidocs.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Parameter list of a callable.
 *
 * Defaults are source texts aligned to the tail of {@code names}: the last
 * {@code defaults.size()} names have defaults, in order.
 */
@Value
@Builder(toBuilder = true)
public class ArgSpec {

    @NonNull
    @Singular("name")
    List<String> names;

    /**
     * Name of the variadic positional parameter, or null.
     */
    String varargsName;

    /**
     * Name of the variadic keyword parameter, or null.
     */
    String varkwName;

    @NonNull
    @Singular("defaultValue")
    List<String> defaults;

    /**
     * Index of the first name that carries a default.
     */
    public int firstDefaultIndex() {
        return names.size() - defaults.size();
    }
}
