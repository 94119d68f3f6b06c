package com.apidocs.generator.model.page;

/**
 * Visitor over the closed set of page kinds.
 */
public interface PageInfoVisitor<R> {
    R visit(FunctionPageInfo page);
    R visit(ClassPageInfo page);
    R visit(ModulePageInfo page);
}
