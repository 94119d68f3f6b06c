package com.apidocs.generator.model.page;

import com.apidocs.generator.model.DocstringSections;
import com.apidocs.generator.model.SourceLocation;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * Page for a class. Member collections keep collection order; the renderer sorts them.
 */
@Getter
@ToString(callSuper = true)
public class ClassPageInfo extends PageInfo {
    private final List<MemberInfo> methods;
    private final List<MemberInfo> properties;
    private final List<MemberInfo> classes;
    private final List<MemberInfo> otherMembers;

    @Builder
    public ClassPageInfo(String fullName, List<String> aliases, SourceLocation definedIn,
                         String guides, DocstringSections doc,
                         @Singular List<MemberInfo> methods,
                         @Singular("property") List<MemberInfo> properties,
                         @Singular("childClass") List<MemberInfo> classes,
                         @Singular List<MemberInfo> otherMembers) {
        super(fullName, aliases, definedIn, guides, doc);
        this.methods = methods;
        this.properties = properties;
        this.classes = classes;
        this.otherMembers = otherMembers;
    }

    @Override
    public <R> R accept(PageInfoVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
