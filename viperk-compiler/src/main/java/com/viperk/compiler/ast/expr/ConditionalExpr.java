package com.viperk.compiler.ast.expr;

import com.viperk.compiler.ast.ExprVisitor;
import com.viperk.compiler.ast.SourceLocation;

/**
 * 条件表达式 {@code body if condition else orElse}
 */
public class ConditionalExpr extends Expression {
    private final Expression body;
    private final Expression condition;
    private final Expression orElse;

    public ConditionalExpr(SourceLocation location, Expression body, Expression condition, Expression orElse) {
        super(location);
        this.body = body;
        this.condition = condition;
        this.orElse = orElse;
    }

    public Expression getBody() {
        return body;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getOrElse() {
        return orElse;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitConditionalExpr(this, context);
    }
}
