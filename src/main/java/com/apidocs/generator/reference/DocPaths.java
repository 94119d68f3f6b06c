package com.apidocs.generator.reference;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;

/**
 * Path conventions of generated pages. Paths always use forward slashes,
 * whatever the platform.
 */
public class DocPaths {

    private DocPaths() {
        // Utility class
    }

    /**
     * Page path of a dotted name: {@code a.b.C} lives at {@code a/b/C.md}.
     */
    public static String documentationPath(String fullName) {
        return fullName.replace('.', '/') + ".md";
    }

    /**
     * Path from the page of {@code fullName} back to the API root:
     * {@code "."} for top-level names, {@code "../.."} for {@code a.b.C}.
     */
    public static String relativePathToRoot(String fullName) {
        int depth = (int) fullName.chars().filter(c -> c == '.').count();
        if (depth == 0) {
            return ".";
        }
        return String.join("/", Collections.nCopies(depth, ".."));
    }

    public static String join(String base, String path) {
        if (base == null || base.isEmpty()) {
            return path;
        }
        if (path.startsWith("/")) {
            return path;
        }
        return base.endsWith("/") ? base + path : base + "/" + path;
    }

    /**
     * Collapses {@code .} and {@code ..} segments. Leading {@code ..} segments of a
     * relative path are kept.
     */
    public static String normalize(String path) {
        boolean absolute = path.startsWith("/");
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty() && !segments.peekLast().equals("..")) {
                    segments.removeLast();
                } else if (!absolute) {
                    segments.addLast(segment);
                }
            } else {
                segments.addLast(segment);
            }
        }
        String joined = String.join("/", segments);
        if (absolute) {
            return "/" + joined;
        }
        return joined.isEmpty() ? "." : joined;
    }
}
