package com.viperk.compiler.ast.decl;

import com.viperk.compiler.ast.AstNode;
import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.expr.Expression;

/**
 * 装饰器 {@code @expression}
 */
public class Decorator extends AstNode {
    private final Expression expression;

    public Decorator(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }
}
