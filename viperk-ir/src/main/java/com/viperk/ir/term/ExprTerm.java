package com.viperk.ir.term;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * 表达式项：常量、变量引用链、运算与调用
 */
public abstract class ExprTerm extends Term {

    public static final ExprTerm SELF = new ExprTerm() {
        @Override
        public void render(StringBuilder out) {
            out.append("%self");
        }
    };

    ExprTerm() {
    }

    // ==================== 常量 ====================

    /** 十进制整数常量 */
    public static final class IntConst extends ExprTerm {
        private final BigInteger value;

        public IntConst(BigInteger value) {
            this.value = value;
        }

        public BigInteger getValue() {
            return value;
        }

        @Override
        public void render(StringBuilder out) {
            out.append(value);
        }
    }

    /** {@code %hex("ff")}：数字取自源码，大小写保持不变 */
    public static final class HexConst extends ExprTerm {
        private final String digits;

        public HexConst(String digits) {
            this.digits = digits;
        }

        public String getDigits() {
            return digits;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%hex(\"").append(digits).append("\")");
        }
    }

    /** {@code %fixed10(A, B)}，值为 A/B，B 为 10 的幂 */
    public static final class FixedPointConst extends ExprTerm {
        private final BigInteger numerator;
        private final BigInteger denominator;

        public FixedPointConst(BigInteger numerator, BigInteger denominator) {
            this.numerator = numerator;
            this.denominator = denominator;
        }

        public BigInteger getNumerator() {
            return numerator;
        }

        public BigInteger getDenominator() {
            return denominator;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%fixed10(").append(numerator).append(", ").append(denominator).append(')');
        }
    }

    /** 字符串常量，内容原样放在双引号之间 */
    public static final class StringConst extends ExprTerm {
        private final String value;

        public StringConst(String value) {
            this.value = value;
        }

        @Override
        public void render(StringBuilder out) {
            out.append('"').append(value).append('"');
        }
    }

    public static final class BoolConst extends ExprTerm {
        private final boolean value;

        public BoolConst(boolean value) {
            this.value = value;
        }

        @Override
        public void render(StringBuilder out) {
            out.append(value);
        }
    }

    // ==================== 变量引用 ====================

    /** {@code %var(x)} */
    public static final class Var extends ExprTerm {
        private final String name;

        public Var(String name) {
            this.name = name;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%var(").append(name).append(')');
        }
    }

    /** {@code %svar(x)}：合约存储变量 self.x */
    public static final class StorageVar extends ExprTerm {
        private final String name;

        public StorageVar(String name) {
            this.name = name;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%svar(").append(name).append(')');
        }
    }

    /** {@code %attribute(BASE, f)} */
    public static final class Attribute extends ExprTerm {
        private final ExprTerm base;
        private final String field;

        public Attribute(ExprTerm base, String field) {
            this.base = base;
            this.field = field;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%attribute(");
            base.render(out);
            out.append(", ").append(field).append(')');
        }
    }

    /** {@code %subscript(BASE, E)} */
    public static final class Subscript extends ExprTerm {
        private final ExprTerm base;
        private final ExprTerm index;

        public Subscript(ExprTerm base, ExprTerm index) {
            this.base = base;
            this.index = index;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%subscript(");
            base.render(out);
            out.append(", ");
            index.render(out);
            out.append(')');
        }
    }

    /** 保留属性：{@code %msg.sender}、{@code %block.timestamp} 等 */
    public static final class ReservedProperty extends ExprTerm {
        private final String object;
        private final String property;

        public ReservedProperty(String object, String property) {
            this.object = object;
            this.property = property;
        }

        @Override
        public void render(StringBuilder out) {
            out.append('%').append(object).append('.').append(property);
        }
    }

    /** {@code %list(E1 E2)} */
    public static final class ListLiteral extends ExprTerm {
        private final List<ExprTerm> elements;

        public ListLiteral(List<ExprTerm> elements) {
            this.elements = Collections.unmodifiableList(elements);
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%list(");
            renderList(out, elements, " ");
            out.append(')');
        }
    }

    // ==================== 运算 ====================

    /**
     * 二元形式的运算：{@code %binop}、{@code %compareop}、{@code %boolop}
     */
    public static final class Operation extends ExprTerm {
        private final String tag;
        private final String symbol;
        private final ExprTerm left;
        private final ExprTerm right;

        private Operation(String tag, String symbol, ExprTerm left, ExprTerm right) {
            this.tag = tag;
            this.symbol = symbol;
            this.left = left;
            this.right = right;
        }

        public static Operation binOp(String symbol, ExprTerm left, ExprTerm right) {
            return new Operation("%binop", symbol, left, right);
        }

        public static Operation compareOp(String symbol, ExprTerm left, ExprTerm right) {
            return new Operation("%compareop", symbol, left, right);
        }

        public static Operation boolOp(String symbol, ExprTerm left, ExprTerm right) {
            return new Operation("%boolop", symbol, left, right);
        }

        public String getTag() {
            return tag;
        }

        public String getSymbol() {
            return symbol;
        }

        @Override
        public void render(StringBuilder out) {
            out.append(tag).append('(').append(symbol).append(", ");
            left.render(out);
            out.append(", ");
            right.render(out);
            out.append(')');
        }
    }

    /** {@code %unaryop(%not, E)} / {@code %unaryop(%neg, E)} */
    public static final class UnaryOperation extends ExprTerm {
        private final String symbol;
        private final ExprTerm operand;

        public UnaryOperation(String symbol, ExprTerm operand) {
            this.symbol = symbol;
            this.operand = operand;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%unaryop(").append(symbol).append(", ");
            operand.render(out);
            out.append(')');
        }
    }

    // ==================== 调用 ====================

    /** 合约内部调用 {@code %icall(m, E1 E2)} */
    public static final class InternalCall extends ExprTerm {
        private final String method;
        private final List<ExprTerm> args;

        public InternalCall(String method, List<ExprTerm> args) {
            this.method = method;
            this.args = Collections.unmodifiableList(args);
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%icall(").append(method).append(", ");
            renderList(out, args, " ");
            out.append(')');
        }
    }

    /** {@code %as_wei_value(E, unit)}：单位为裸标识符 */
    public static final class WeiValue extends ExprTerm {
        private final ExprTerm amount;
        private final String unit;

        public WeiValue(ExprTerm amount, String unit) {
            this.amount = amount;
            this.unit = unit;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%as_wei_value(");
            amount.render(out);
            out.append(", ").append(unit).append(')');
        }
    }

    /** 按名调用 {@code %fn(E1, E2)}，参数以逗号分隔 */
    public static final class Call extends ExprTerm {
        private final String function;
        private final List<ExprTerm> args;

        public Call(String function, List<ExprTerm> args) {
            this.function = function;
            this.args = Collections.unmodifiableList(args);
        }

        @Override
        public void render(StringBuilder out) {
            out.append('%').append(function).append('(');
            renderList(out, args, ", ");
            out.append(')');
        }
    }
}
