package com.apidocs.generator.argspec;

import com.apidocs.generator.exception.OverBoundArgSpecException;
import com.apidocs.generator.model.ArgSpec;
import com.apidocs.generator.model.CallableSignature;
import com.apidocs.generator.model.PartialBinding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the parameter list a caller sees after partial bindings have been applied.
 *
 * Stateless: safe to share.
 */
public class ArgSpecResolver {
    private static final Logger log = LoggerFactory.getLogger(ArgSpecResolver.class);

    /**
     * Applies every binding of {@code signature}, innermost first.
     *
     * @throws OverBoundArgSpecException if a binding supplies more positional values than names remain
     */
    public ArgSpec resolve(CallableSignature signature) {
        ArgSpec current = signature.getDeclared();
        for (PartialBinding binding : signature.getBindings()) {
            current = apply(current, binding);
        }
        return current;
    }

    /**
     * Applies one binding: positional values first, then keywords.
     */
    public ArgSpec apply(ArgSpec spec, PartialBinding binding) {
        List<String> names = spec.getNames();
        List<String> defaults = spec.getDefaults();
        int firstDefault = spec.firstDefaultIndex();
        int bound = binding.getPositionalValues().size();

        if (bound > names.size()) {
            throw new OverBoundArgSpecException(bound, names.size());
        }

        List<String> remainingNames = new ArrayList<>(names.subList(bound, names.size()));
        List<String> remainingDefaults = new ArrayList<>(defaults);
        if (bound > firstDefault) {
            remainingDefaults = new ArrayList<>(defaults.subList(bound - firstDefault, defaults.size()));
        }
        firstDefault = Math.max(0, firstDefault - bound);

        for (String keyword : binding.getKeywordValues().keySet()) {
            int i = remainingNames.indexOf(keyword);
            if (i < 0) {
                // Absorbed by the variadic keyword parameter, if any.
                log.debug("Keyword binding {} names no remaining parameter of {}", keyword, names);
                continue;
            }
            remainingNames.remove(i);
            if (i >= firstDefault) {
                remainingDefaults.remove(i - firstDefault);
            } else {
                firstDefault--;
            }
        }

        return ArgSpec.builder()
                .names(remainingNames)
                .varargsName(spec.getVarargsName())
                .varkwName(spec.getVarkwName())
                .defaults(remainingDefaults)
                .build();
    }
}
