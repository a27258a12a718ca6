package com.viperk.compiler.ast.expr;

import com.viperk.compiler.ast.ExprVisitor;
import com.viperk.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 比较表达式
 *
 * <p>保留链式比较的原始形状：{@code a < b < c} 为 left=a，
 * operators=[LT, LT]，comparators=[b, c]。</p>
 */
public class CompareExpr extends Expression {
    private final Expression left;
    private final List<CompareOp> operators;
    private final List<Expression> comparators;

    public CompareExpr(SourceLocation location, Expression left,
                       List<CompareOp> operators, List<Expression> comparators) {
        super(location);
        this.left = left;
        this.operators = operators;
        this.comparators = comparators;
    }

    public Expression getLeft() {
        return left;
    }

    public List<CompareOp> getOperators() {
        return operators;
    }

    public List<Expression> getComparators() {
        return comparators;
    }

    public boolean isChained() {
        return operators.size() > 1 || comparators.size() > 1;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitCompareExpr(this, context);
    }

    /**
     * 比较运算符
     */
    public enum CompareOp {
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        IN("in"),
        NOT_IN("not in"),
        IS("is"),
        IS_NOT("is not");

        private final String source;

        CompareOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
