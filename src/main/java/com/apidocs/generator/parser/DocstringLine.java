package com.apidocs.generator.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One physical line of a docstring, classified by shape alone.
 * Whether a line really acts as a section header or item is decided by the parser.
 */
@Data
@AllArgsConstructor
public class DocstringLine {
    private LineType type;
    /**
     * Line content without its terminator.
     */
    private String content;
    /**
     * "\n", or "" for a last line without newline.
     */
    private String terminator;
    private int index;
    /**
     * Section keyword, compatibility target or item name, depending on {@link #type}.
     */
    private String label;
    /**
     * Leading whitespace of an item line.
     */
    private String indent;
    /**
     * Text after the item colon.
     */
    private String rest;

    public enum LineType {
        TEXT,
        BLANK,
        SECTION_HEADER,
        ITEM,
        COMPATIBILITY_OPEN,
        COMPATIBILITY_CLOSE
    }

    public static DocstringLine of(LineType type, String content, String terminator, int index) {
        return new DocstringLine(type, content, terminator, index, null, null, null);
    }

    /**
     * The line exactly as it appeared in the source.
     */
    public String raw() {
        return content + terminator;
    }
}
