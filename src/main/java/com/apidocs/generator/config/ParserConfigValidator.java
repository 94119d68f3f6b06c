package com.apidocs.generator.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.apidocs.generator.exception.ConfigValidationException;

/**
 * Checks the invariants a run configuration must satisfy before any page is built.
 * Reports every violation at once.
 */
public class ParserConfigValidator {

    public void validate(ParserConfig config) {
        List<String> errors = new ArrayList<>();
        SymbolIndex index = config.getSymbolIndex();

        for (Map.Entry<String, String> entry : index.getDuplicateOf().entrySet()) {
            String alias = entry.getKey();
            String canonical = entry.getValue();

            if (alias.equals(canonical)) {
                errors.add("Alias maps to itself: " + alias);
                continue;
            }
            if (!index.contains(canonical)) {
                errors.add("Canonical name " + canonical + " of alias " + alias + " is not in the symbol index.");
            }
            if (index.isAlias(canonical)) {
                errors.add("Alias chain longer than one hop: " + alias + " -> " + canonical + " -> "
                        + index.canonicalName(canonical));
            }
        }

        for (String parent : config.getTree().keySet()) {
            if (!parent.isEmpty() && !index.contains(parent)) {
                errors.add("Name tree parent is not in the symbol index: " + parent);
            }
        }

        if (isBlank(config.getReceiverName())) {
            errors.add("Receiver parameter name must not be blank.");
        }

        if (!errors.isEmpty()) {
            throw new ConfigValidationException(errors);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
