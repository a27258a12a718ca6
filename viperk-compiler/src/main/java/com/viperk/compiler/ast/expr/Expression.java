package com.viperk.compiler.ast.expr;

import com.viperk.compiler.ast.AstNode;
import com.viperk.compiler.ast.ExprVisitor;
import com.viperk.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(ExprVisitor<R, C> visitor, C context);
}
