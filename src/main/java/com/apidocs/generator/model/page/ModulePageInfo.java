package com.apidocs.generator.model.page;

import com.apidocs.generator.model.DocstringSections;
import com.apidocs.generator.model.SourceLocation;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * Page for a module. Members are kept in name tree order.
 */
@Getter
@ToString(callSuper = true)
public class ModulePageInfo extends PageInfo {
    private final List<MemberInfo> members;

    @Builder
    public ModulePageInfo(String fullName, List<String> aliases, SourceLocation definedIn,
                          String guides, DocstringSections doc,
                          @Singular List<MemberInfo> members) {
        super(fullName, aliases, definedIn, guides, doc);
        this.members = members;
    }

    @Override
    public <R> R accept(PageInfoVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
