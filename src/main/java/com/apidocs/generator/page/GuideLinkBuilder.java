package com.apidocs.generator.page;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

import com.apidocs.generator.config.ParserConfig;
import com.apidocs.generator.model.GuideReference;
import com.apidocs.generator.reference.DocPaths;

/**
 * Renders the "See the guide" line of a page from the guides mentioning the symbol
 * under any of its names.
 */
public class GuideLinkBuilder {

    private final ParserConfig config;

    public GuideLinkBuilder(ParserConfig config) {
        this.config = config;
    }

    /**
     * @return the guide line followed by a blank line, or an empty string when no guide mentions any name
     */
    public String build(Collection<String> names, String relativeRoot) {
        TreeSet<String> links = new TreeSet<>();
        for (String name : names) {
            for (GuideReference guide : config.getGuideIndex().getOrDefault(name, List.of())) {
                String url = DocPaths.normalize(DocPaths.join(DocPaths.join(relativeRoot, "../.."), guide.getUrl()));
                links.add("[" + guide.getLinkText() + "](" + url + ")");
            }
        }
        if (links.isEmpty()) {
            return "";
        }
        String label = links.size() == 1 ? "See the guide: " : "See the guides: ";
        return label + String.join(", ", links) + "\n\n";
    }
}
