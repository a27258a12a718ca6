package com.viperk.ir.translate;

import com.viperk.compiler.ast.expr.Literal;
import com.viperk.ir.term.ExprTerm;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * 字面量翻译：整数（含十六进制写法恢复）、定点小数、字符串与布尔值
 */
public final class ConstTranslator {

    /** 定点小数最多保留的小数位数 */
    static final int MAX_DECIMAL_PLACES = 10;

    private final SourceLines sourceLines;

    public ConstTranslator(SourceLines sourceLines) {
        this.sourceLines = sourceLines;
    }

    public ExprTerm translate(Literal literal) {
        switch (literal.getKind()) {
            case INT: {
                String hex = sourceLines.hexDigitsAt(literal.getLocation());
                if (hex != null) {
                    return new ExprTerm.HexConst(hex);
                }
                return new ExprTerm.IntConst(literal.intValue());
            }
            case DECIMAL:
                return toFixed10(literal.decimalValue());
            case STRING:
                return new ExprTerm.StringConst(literal.stringValue());
            case BOOLEAN:
                return new ExprTerm.BoolConst((Boolean) literal.getValue());
            case NONE:
                throw UnsupportedConstructException.detail("None is not supported", literal.getLocation());
            default:
                throw UnsupportedConstructException.structural(
                        "Unsupported literal: " + literal.getKind(), literal.getLocation());
        }
    }

    /**
     * 小数 → {@code %fixed10(A, B)}：B 取使 A 为整数的最小 10 的幂，
     * 超过 10 位小数时 B 固定为 10^10，A 按银行家舍入。
     */
    public static ExprTerm.FixedPointConst toFixed10(BigDecimal value) {
        BigDecimal normalized = value.stripTrailingZeros();
        if (normalized.scale() <= 0) {
            return new ExprTerm.FixedPointConst(normalized.toBigIntegerExact(), BigInteger.ONE);
        }
        if (normalized.scale() > MAX_DECIMAL_PLACES) {
            BigDecimal rounded = normalized.setScale(MAX_DECIMAL_PLACES, RoundingMode.HALF_EVEN);
            return new ExprTerm.FixedPointConst(rounded.unscaledValue(), BigInteger.TEN.pow(MAX_DECIMAL_PLACES));
        }
        return new ExprTerm.FixedPointConst(normalized.unscaledValue(), BigInteger.TEN.pow(normalized.scale()));
    }
}
