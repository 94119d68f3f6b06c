package com.apidocs.generator.argspec;

import com.apidocs.generator.model.ArgSpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders an effective parameter list as source text, e.g. {@code (x, axis=None, *args, **kwargs)}.
 */
public class SignatureFormatter {
    private static final Logger log = LoggerFactory.getLogger(SignatureFormatter.class);

    private final String receiverName;
    private final Map<String, String> defaultValueAliases;

    /**
     * @param receiverName leading parameter dropped for class members
     * @param defaultValueAliases default-value text (or dotted prefix) to the public name it renders as
     */
    public SignatureFormatter(String receiverName, Map<String, String> defaultValueAliases) {
        this.receiverName = receiverName;
        this.defaultValueAliases = defaultValueAliases;
    }

    /**
     * @param classMember whether the callable belongs to a class, in which case a leading
     *                    receiver parameter is omitted
     */
    public String format(ArgSpec spec, boolean classMember) {
        List<String> names = spec.getNames();
        List<String> defaults = spec.getDefaults();
        int firstDefault = spec.firstDefaultIndex();
        int start = classMember && !names.isEmpty() && names.get(0).equals(receiverName) ? 1 : 0;

        List<String> args = new ArrayList<>();
        for (int i = start; i < firstDefault; i++) {
            args.add(names.get(i));
        }
        for (int i = Math.max(start, firstDefault); i < names.size(); i++) {
            args.add(names.get(i) + "=" + defaultText(defaults.get(i - firstDefault)));
        }

        if (spec.getVarargsName() != null) {
            args.add("*" + spec.getVarargsName());
        }
        if (spec.getVarkwName() != null) {
            args.add("**" + spec.getVarkwName());
        }
        return "(" + String.join(", ", args) + ")";
    }

    String defaultText(String text) {
        String exact = defaultValueAliases.get(text);
        if (exact != null) {
            return exact;
        }
        // Longest dotted prefix wins: "ops.Keys.VARS" matches "ops.Keys" before "ops".
        int end = text.lastIndexOf('.');
        while (end > 0) {
            String alias = defaultValueAliases.get(text.substring(0, end));
            if (alias != null) {
                log.debug("Rendering default {} as {}", text, alias + text.substring(end));
                return alias + text.substring(end);
            }
            end = text.lastIndexOf('.', end - 1);
        }
        return text;
    }
}
