package com.viperk.compiler.ast.expr;

import com.viperk.compiler.ast.ExprVisitor;
import com.viperk.compiler.ast.SourceLocation;

/**
 * 标识符表达式
 */
public class Name extends Expression {
    private final String id;

    public Name(SourceLocation location, String id) {
        super(location);
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /** 是否为给定名称的标识符 */
    public static boolean is(Expression expr, String id) {
        return expr instanceof Name && ((Name) expr).getId().equals(id);
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitName(this, context);
    }
}
