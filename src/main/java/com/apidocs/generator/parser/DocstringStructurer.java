package com.apidocs.generator.parser;

import com.apidocs.generator.model.DocstringSections;

/**
 * Entry point for turning docstring text into {@link DocstringSections}.
 *
 * Stateless: each call scans and parses independently.
 */
public class DocstringStructurer {

    public DocstringSections structure(String docstring) {
        DocstringLineScanner scanner = new DocstringLineScanner(docstring);
        DocstringParser parser = new DocstringParser(scanner.scan());
        return parser.parse();
    }
}
