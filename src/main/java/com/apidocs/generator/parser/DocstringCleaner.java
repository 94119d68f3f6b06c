package com.apidocs.generator.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Normalizes raw docstrings before they are structured.
 */
public class DocstringCleaner {

    private static final Pattern SYMBOL_MARKER = Pattern.compile("^ *@@[a-zA-Z_.0-9]+ *$");
    private static final int TAB_SIZE = 8;

    private DocstringCleaner() {
        // Utility class
    }

    /**
     * Removes the indentation docstrings inherit from the surrounding source.
     *
     * The first line loses its leading whitespace, the remaining lines lose their
     * common margin, and leading and trailing blank lines are dropped.
     */
    public static String clean(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String normalized = raw.replace("\r\n", "\n").replace('\r', '\n');
        List<String> lines = new ArrayList<>(Arrays.asList(normalized.split("\n", -1)));
        lines.replaceAll(DocstringCleaner::expandTabs);

        int margin = Integer.MAX_VALUE;
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            String content = line.stripLeading();
            if (!content.isEmpty()) {
                margin = Math.min(margin, line.length() - content.length());
            }
        }

        lines.set(0, lines.get(0).stripLeading());
        if (margin < Integer.MAX_VALUE) {
            for (int i = 1; i < lines.size(); i++) {
                String line = lines.get(i);
                lines.set(i, line.length() > margin ? line.substring(margin) : line.stripLeading());
            }
        }

        while (!lines.isEmpty() && lines.get(0).isBlank()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        return String.join("\n", lines);
    }

    /**
     * Drops lines consisting solely of an {@code @@symbol} marker.
     */
    public static String stripSymbolMarkers(String text) {
        return Arrays.stream(text.split("\n", -1))
                .filter(line -> !SYMBOL_MARKER.matcher(line).matches())
                .collect(Collectors.joining("\n"));
    }

    static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder sb = new StringBuilder();
        for (char c : line.toCharArray()) {
            if (c == '\t') {
                int spaces = TAB_SIZE - (sb.length() % TAB_SIZE);
                sb.append(" ".repeat(spaces));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
