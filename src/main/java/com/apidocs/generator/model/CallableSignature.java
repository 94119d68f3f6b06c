package com.apidocs.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A declared parameter list plus the partial bindings wrapped around it,
 * innermost binding first.
 */
@Value
@Builder
public class CallableSignature {

    @NonNull
    ArgSpec declared;

    @NonNull
    @Singular("binding")
    List<PartialBinding> bindings;

    public static CallableSignature of(ArgSpec declared) {
        return CallableSignature.builder().declared(declared).build();
    }

    public boolean isPartial() {
        return !bindings.isEmpty();
    }
}
