package com.viperk.compiler.ast.expr;

import com.viperk.compiler.ast.ExprVisitor;
import com.viperk.compiler.ast.SourceLocation;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 字面量表达式
 *
 * <p>值类型：INT → {@link BigInteger}，DECIMAL → {@link BigDecimal}，
 * STRING → String，BOOLEAN → Boolean，NONE → null。</p>
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    public BigInteger intValue() {
        return (BigInteger) value;
    }

    public BigDecimal decimalValue() {
        return (BigDecimal) value;
    }

    public String stringValue() {
        return (String) value;
    }

    public boolean isInteger() {
        return kind == LiteralKind.INT;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        DECIMAL,
        STRING,
        BOOLEAN,
        NONE
    }
}
