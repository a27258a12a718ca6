package com.viperk.compiler.ast.expr;

import com.viperk.compiler.ast.ExprVisitor;
import com.viperk.compiler.ast.SourceLocation;

/**
 * 属性访问表达式 target.attr
 */
public class AttributeExpr extends Expression {
    private final Expression target;
    private final String attr;

    public AttributeExpr(SourceLocation location, Expression target, String attr) {
        super(location);
        this.target = target;
        this.attr = attr;
    }

    public Expression getTarget() {
        return target;
    }

    public String getAttr() {
        return attr;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitAttributeExpr(this, context);
    }
}
