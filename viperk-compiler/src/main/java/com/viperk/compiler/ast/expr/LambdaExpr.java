package com.viperk.compiler.ast.expr;

import com.viperk.compiler.ast.ExprVisitor;
import com.viperk.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 匿名函数 {@code lambda a, b: body}
 */
public class LambdaExpr extends Expression {
    private final List<String> params;
    private final Expression body;

    public LambdaExpr(SourceLocation location, List<String> params, Expression body) {
        super(location);
        this.params = params;
        this.body = body;
    }

    public List<String> getParams() {
        return params;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitLambdaExpr(this, context);
    }
}
