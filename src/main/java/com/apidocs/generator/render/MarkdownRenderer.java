package com.apidocs.generator.render;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

import com.apidocs.generator.model.DetailItem;
import com.apidocs.generator.model.DocstringSections;
import com.apidocs.generator.model.FunctionDetail;
import com.apidocs.generator.model.SourceLocation;
import com.apidocs.generator.model.page.ClassPageInfo;
import com.apidocs.generator.model.page.FunctionPageInfo;
import com.apidocs.generator.model.page.MemberInfo;
import com.apidocs.generator.model.page.ModulePageInfo;
import com.apidocs.generator.model.page.PageInfo;
import com.apidocs.generator.model.page.PageInfoVisitor;

/**
 * Serializes page models to markdown.
 *
 * Output is a pure function of the page model. Class members are sorted by short
 * name, module members keep their collection order.
 */
public class MarkdownRenderer implements PageInfoVisitor<String> {

    private static final Comparator<MemberInfo> BY_SHORT_NAME = Comparator.comparing(MemberInfo::getShortName);

    public String render(PageInfo page) {
        Objects.requireNonNull(page, "page");
        return page.accept(this);
    }

    @Override
    public String visit(FunctionPageInfo page) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(page.getFullName()).append(page.getSignature()).append("\n\n");

        if (!page.getAliases().isEmpty()) {
            page.getAliases().forEach(alias ->
                    sb.append("### `").append(alias).append(page.getSignature()).append("`\n"));
            sb.append('\n');
        }

        appendDefinedIn(sb, page);
        sb.append(page.getGuides());
        sb.append(page.getDoc().getDocstring());
        sb.append(details(page.getDoc().getDetails()));
        sb.append(compatibility(page.getDoc().getCompatibility()));
        return sb.toString();
    }

    @Override
    public String visit(ClassPageInfo page) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(page.getFullName()).append("\n\n");

        if (!page.getAliases().isEmpty()) {
            page.getAliases().forEach(alias -> sb.append("### `class ").append(alias).append("`\n"));
            sb.append('\n');
        }

        appendDefinedIn(sb, page);
        sb.append(page.getGuides());
        sb.append(page.getDoc().getDocstring());
        sb.append(details(page.getDoc().getDetails()));
        sb.append(compatibility(page.getDoc().getCompatibility()));
        sb.append("\n\n");

        if (!page.getClasses().isEmpty()) {
            sb.append("## Child Classes\n");
            page.getClasses().stream()
                    .map(c -> "[`class %s`](%s)\n\n".formatted(c.getShortName(), c.getUrl()))
                    .sorted()
                    .forEach(sb::append);
        }

        if (!page.getProperties().isEmpty()) {
            sb.append("## Properties\n\n");
            for (MemberInfo property : sorted(page.getProperties())) {
                sb.append("<h3 id=\"%1$s\"><code>%1$s</code></h3>\n\n".formatted(property.getShortName()));
                sb.append(property.getDoc().getDocstring());
                sb.append(details(property.getDoc().getDetails()));
                sb.append(compatibility(property.getDoc().getCompatibility()));
                sb.append("\n\n");
            }
            sb.append("\n\n");
        }

        if (!page.getMethods().isEmpty()) {
            sb.append("## Methods\n\n");
            for (MemberInfo method : sorted(page.getMethods())) {
                String signature = method.getSignature() != null ? method.getSignature() : "";
                sb.append("<h3 id=\"%1$s\"><code>%1$s%2$s</code></h3>\n\n".formatted(method.getShortName(), signature));
                DocstringSections doc = method.getDoc();
                sb.append(doc.getDocstring());
                sb.append(details(doc.getDetails()));
                sb.append(compatibility(doc.getCompatibility()));
                sb.append("\n\n");
            }
            sb.append("\n\n");
        }

        if (!page.getOtherMembers().isEmpty()) {
            sb.append("## Class Members\n\n");
            for (MemberInfo other : sorted(page.getOtherMembers())) {
                sb.append("<h3 id=\"%1$s\"><code>%1$s</code></h3>\n\n".formatted(other.getShortName()));
            }
        }
        return sb.toString();
    }

    @Override
    public String visit(ModulePageInfo page) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Module: ").append(page.getFullName()).append("\n\n");

        if (!page.getAliases().isEmpty()) {
            page.getAliases().forEach(alias -> sb.append("### Module `").append(alias).append("`\n"));
            sb.append('\n');
        }

        appendDefinedIn(sb, page);
        sb.append(page.getDoc().getDocstring());
        sb.append("\n\n");
        sb.append("## Members\n\n");

        String members = page.getMembers().stream()
                .map(MarkdownRenderer::moduleMember)
                .collect(Collectors.joining("\n\n"));
        sb.append(members);
        return sb.toString();
    }

    private static String moduleMember(MemberInfo member) {
        if (!member.isLinkable()) {
            return "Constant " + member.getShortName();
        }

        String linkText;
        String suffix = "";
        switch (member.getKind()) {
            case CLASS -> linkText = "class " + member.getShortName();
            case FUNCTION -> linkText = member.getShortName() + "(...)";
            case MODULE -> {
                linkText = member.getShortName();
                suffix = " module";
            }
            default -> linkText = member.getShortName();
        }

        String brief = member.getDoc().getBrief();
        if (!brief.isEmpty()) {
            suffix = suffix + ": " + brief;
        }
        return "[`%s`](%s)%s".formatted(linkText, member.getUrl(), suffix);
    }

    private static void appendDefinedIn(StringBuilder sb, PageInfo page) {
        page.findDefinedIn().ifPresent(location -> sb.append("\n\n").append(definedIn(location)));
    }

    static String definedIn(SourceLocation location) {
        return switch (location.getKind()) {
            case BUILTIN -> "Built-in.\n\n";
            case GENERATED -> "Defined in generated file: `%s`.\n\n".formatted(location.getPath());
            case SOURCE -> location.getUrl() != null
                    ? "Defined in [`%s`](%s).\n\n".formatted(location.getPath(), location.getUrl())
                    : "Defined in `%s`.\n\n".formatted(location.getPath());
        };
    }

    static String details(List<FunctionDetail> details) {
        return details.stream()
                .map(MarkdownRenderer::detail)
                .collect(Collectors.joining("\n"));
    }

    private static String detail(FunctionDetail detail) {
        StringBuilder sb = new StringBuilder();
        sb.append("#### ").append(detail.getKeyword()).append(":\n\n");
        sb.append(detail.getHeader());
        for (DetailItem item : detail.getItems()) {
            sb.append("* **").append(item.getName()).append("**:").append(item.getDescription());
        }
        return sb.toString();
    }

    static String compatibility(Map<String, String> notes) {
        StringBuilder sb = new StringBuilder();
        new TreeMap<>(notes).forEach((target, text) ->
                sb.append("\n\n#### ").append(target).append(" compatibility\n").append(text).append('\n'));
        return sb.toString();
    }

    private static List<MemberInfo> sorted(List<MemberInfo> members) {
        return members.stream().sorted(BY_SHORT_NAME).toList();
    }
}
