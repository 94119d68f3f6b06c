package com.apidocs.generator.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidocs.generator.model.DetailItem;
import com.apidocs.generator.model.DocstringSections;
import com.apidocs.generator.model.FunctionDetail;
import com.apidocs.generator.parser.DocstringLine.LineType;

/**
 * Partitions scanned docstring lines into body text, detail sections and
 * compatibility notes.
 *
 * Parsing only:
 * - Every line lands in exactly one of body, a section or a compatibility note
 * - Compatibility marker lines are dropped
 * - Nothing is resolved or rendered
 *
 * One instance parses one docstring.
 */
public class DocstringParser {
    private static final Logger log = LoggerFactory.getLogger(DocstringParser.class);

    enum ParseState {
        IN_BRIEF,
        IN_BODY,
        IN_COMPATIBILITY_BLOCK,
        IN_DETAIL_HEADER,
        IN_DETAIL_ITEM
    }

    private final List<DocstringLine> lines;

    private ParseState state = ParseState.IN_BRIEF;
    private ParseState resumeState;

    private final StringBuilder body = new StringBuilder();
    private final List<FunctionDetail> details = new ArrayList<>();
    private final Map<String, String> compatibility = new LinkedHashMap<>();

    private String compatibilityTarget;
    private StringBuilder compatibilityText;

    private String keyword;
    private StringBuilder header;
    private String itemIndent;
    private List<DetailItem> items;
    private String itemName;
    private StringBuilder itemDescription;

    public DocstringParser(List<DocstringLine> lines) {
        this.lines = lines;
    }

    public DocstringSections parse() {
        for (DocstringLine line : lines) {
            if (state != ParseState.IN_COMPATIBILITY_BLOCK
                    && line.getType() == LineType.COMPATIBILITY_OPEN
                    && hasClosingMarker(line.getIndex())) {
                openCompatibility(line);
                continue;
            }

            switch (state) {
                case IN_BRIEF -> {
                    body.append(line.raw());
                    state = ParseState.IN_BODY;
                }
                case IN_BODY -> {
                    if (line.getType() == LineType.SECTION_HEADER) {
                        openSection(line);
                    } else {
                        body.append(line.raw());
                    }
                }
                case IN_COMPATIBILITY_BLOCK -> {
                    if (line.getType() == LineType.COMPATIBILITY_CLOSE) {
                        closeCompatibility();
                    } else {
                        compatibilityText.append(line.raw());
                    }
                }
                case IN_DETAIL_HEADER -> {
                    if (line.getType() == LineType.SECTION_HEADER) {
                        closeSection();
                        openSection(line);
                    } else if (line.getType() == LineType.ITEM) {
                        itemIndent = line.getIndent();
                        openItem(line);
                        state = ParseState.IN_DETAIL_ITEM;
                    } else {
                        header.append(line.raw());
                    }
                }
                case IN_DETAIL_ITEM -> {
                    if (line.getType() == LineType.SECTION_HEADER) {
                        closeSection();
                        openSection(line);
                    } else if (line.getType() == LineType.ITEM && line.getIndent().equals(itemIndent)) {
                        closeItem();
                        openItem(line);
                    } else {
                        itemDescription.append(line.raw());
                    }
                }
            }
        }

        if (state == ParseState.IN_DETAIL_HEADER || state == ParseState.IN_DETAIL_ITEM) {
            closeSection();
        }

        String docstring = body.toString();
        int newline = docstring.indexOf('\n');
        String brief = newline < 0 ? docstring : docstring.substring(0, newline);

        return DocstringSections.builder()
                .brief(brief)
                .docstring(docstring)
                .details(details)
                .compatibility(compatibility)
                .build();
    }

    private boolean hasClosingMarker(int openIndex) {
        for (int i = openIndex + 1; i < lines.size(); i++) {
            LineType type = lines.get(i).getType();
            if (type == LineType.COMPATIBILITY_CLOSE) {
                return true;
            }
            if (type == LineType.COMPATIBILITY_OPEN) {
                return false;
            }
        }
        log.debug("Unterminated compatibility block at line {}, kept as text", openIndex);
        return false;
    }

    private void openCompatibility(DocstringLine line) {
        resumeState = state;
        compatibilityTarget = line.getLabel();
        compatibilityText = new StringBuilder();
        state = ParseState.IN_COMPATIBILITY_BLOCK;
    }

    private void closeCompatibility() {
        if (compatibility.containsKey(compatibilityTarget)) {
            log.debug("Compatibility note for {} appears twice, keeping the last one", compatibilityTarget);
        }
        compatibility.put(compatibilityTarget, compatibilityText.toString());
        state = resumeState;
    }

    private void openSection(DocstringLine line) {
        keyword = line.getLabel();
        header = new StringBuilder();
        itemIndent = null;
        items = new ArrayList<>();
        state = ParseState.IN_DETAIL_HEADER;
    }

    private void closeSection() {
        if (state == ParseState.IN_DETAIL_ITEM) {
            closeItem();
        }
        details.add(FunctionDetail.builder()
                .keyword(keyword)
                .header(header.toString())
                .itemIndent(itemIndent != null ? itemIndent : "")
                .items(items)
                .build());
        log.debug("Parsed {} section with {} items", keyword, items.size());
    }

    private void openItem(DocstringLine line) {
        itemName = line.getLabel();
        itemDescription = new StringBuilder(line.getRest()).append(line.getTerminator());
    }

    private void closeItem() {
        items.add(new DetailItem(itemName, itemDescription.toString()));
    }
}
