package com.viperk.compiler.ast.expr;

import com.viperk.compiler.ast.ExprVisitor;
import com.viperk.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 布尔运算表达式
 *
 * <p>同一运算符的连续操作数被展平：{@code a and b and c} 为一个节点、三个操作数。</p>
 */
public class BoolOpExpr extends Expression {
    private final BoolOp operator;
    private final List<Expression> values;

    public BoolOpExpr(SourceLocation location, BoolOp operator, List<Expression> values) {
        super(location);
        this.operator = operator;
        this.values = values;
    }

    public BoolOp getOperator() {
        return operator;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitBoolOpExpr(this, context);
    }

    /**
     * 布尔运算符
     */
    public enum BoolOp {
        AND,
        OR
    }
}
