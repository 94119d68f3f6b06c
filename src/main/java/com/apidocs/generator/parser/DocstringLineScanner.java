package com.apidocs.generator.parser;

import com.apidocs.generator.parser.DocstringLine.LineType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits docstring text into classified lines. Concatenating {@link DocstringLine#raw()}
 * of every line gives back the input.
 */
public class DocstringLineScanner {

    private static final Pattern SECTION_HEADER = Pattern.compile("^([A-Z][A-Za-z]*):$");
    private static final Pattern ITEM = Pattern.compile("^([ \\t]+)(\\*{0,2}\\w[\\w.]*):(.*)$");
    private static final Pattern COMPATIBILITY_OPEN = Pattern.compile("^[ \\t]*@compatibility\\((\\w+)\\)\\s*$");
    private static final Pattern COMPATIBILITY_CLOSE = Pattern.compile("^\\s*@end_compatibility\\s*$");

    private final String source;
    private int pos = 0;

    public DocstringLineScanner(String source) {
        this.source = source != null ? source : "";
    }

    public List<DocstringLine> scan() {
        List<DocstringLine> lines = new ArrayList<>();
        while (pos < source.length()) {
            int newline = source.indexOf('\n', pos);
            String content;
            String terminator;
            if (newline < 0) {
                content = source.substring(pos);
                terminator = "";
                pos = source.length();
            } else {
                content = source.substring(pos, newline);
                terminator = "\n";
                pos = newline + 1;
            }
            lines.add(classify(content, terminator, lines.size()));
        }
        return lines;
    }

    private DocstringLine classify(String content, String terminator, int index) {
        if (content.isBlank()) {
            return DocstringLine.of(LineType.BLANK, content, terminator, index);
        }

        Matcher open = COMPATIBILITY_OPEN.matcher(content);
        if (open.matches()) {
            return new DocstringLine(LineType.COMPATIBILITY_OPEN, content, terminator, index, open.group(1), null, null);
        }
        if (COMPATIBILITY_CLOSE.matcher(content).matches()) {
            return DocstringLine.of(LineType.COMPATIBILITY_CLOSE, content, terminator, index);
        }

        // A header never opens the docstring and always ends its line.
        Matcher header = SECTION_HEADER.matcher(content);
        if (index > 0 && !terminator.isEmpty() && header.matches()) {
            return new DocstringLine(LineType.SECTION_HEADER, content, terminator, index, header.group(1), null, null);
        }

        Matcher item = ITEM.matcher(content);
        if (item.matches()) {
            return new DocstringLine(LineType.ITEM, content, terminator, index, item.group(2), item.group(1), item.group(3));
        }

        return DocstringLine.of(LineType.TEXT, content, terminator, index);
    }
}
