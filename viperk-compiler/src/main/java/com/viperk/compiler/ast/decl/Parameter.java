package com.viperk.compiler.ast.decl;

import com.viperk.compiler.ast.AstNode;
import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.expr.Expression;

/**
 * 函数参数 {@code name[: annotation][= default]}
 */
public class Parameter extends AstNode {
    private final String name;
    private final Expression annotation;    // 可选
    private final Expression defaultValue;  // 可选

    public Parameter(SourceLocation location, String name, Expression annotation, Expression defaultValue) {
        super(location);
        this.name = name;
        this.annotation = annotation;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    public boolean hasAnnotation() {
        return annotation != null;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }
}
