package com.viperk.ir.translate;

import com.viperk.compiler.ast.expr.Expression;
import com.viperk.compiler.ast.expr.Literal;
import com.viperk.compiler.lexer.Lexer;
import com.viperk.compiler.parser.Parser;
import com.viperk.ir.term.ExprTerm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 字面量翻译测试
 */
class ConstTranslatorTest {

    private String translate(String source) {
        Expression expr = new Parser(new Lexer(source, "<test>")).parseStandaloneExpression();
        return new ConstTranslator(new SourceLines(source)).translate((Literal) expr).render();
    }

    @Nested
    @DisplayName("整数")
    class IntTests {

        @Test
        @DisplayName("十进制原样输出")
        void testDecimalInt() {
            assertEquals("42", translate("42"));
            assertEquals("115792089237316195423570985008687907853269984665640564039457584007913129639935",
                    translate("115792089237316195423570985008687907853269984665640564039457584007913129639935"));
        }

        @Test
        @DisplayName("小写 0x 前缀恢复十六进制写法")
        void testHex() {
            assertEquals("%hex(\"ff\")", translate("0xff"));
            assertEquals("%hex(\"00Ab\")", translate("0x00Ab"));
        }

        @Test
        @DisplayName("大写 0X 前缀按数值输出")
        void testUpperHexPrefix() {
            assertEquals("255", translate("0XFF"));
        }

        @Test
        @DisplayName("其他进制按数值输出")
        void testOtherRadix() {
            assertEquals("15", translate("0o17"));
            assertEquals("5", translate("0b101"));
        }
    }

    @Nested
    @DisplayName("定点小数")
    class FixedPointTests {

        private String fixed(String value) {
            return ConstTranslator.toFixed10(new BigDecimal(value)).render();
        }

        @Test
        @DisplayName("分母取最小的 10 的幂")
        void testSmallestPower() {
            assertEquals("%fixed10(25, 10)", fixed("2.5"));
            assertEquals("%fixed10(125, 1000)", fixed("0.125"));
            assertEquals("%fixed10(25, 10)", fixed("2.50"));
        }

        @Test
        @DisplayName("整数值的小数分母为 1")
        void testIntegral() {
            assertEquals("%fixed10(3, 1)", fixed("3.0"));
            assertEquals("%fixed10(1000, 1)", fixed("1e3"));
        }

        @Test
        @DisplayName("超过 10 位小数时银行家舍入")
        void testRounding() {
            ExprTerm.FixedPointConst c = ConstTranslator.toFixed10(new BigDecimal("0.00000000005"));
            assertEquals(BigInteger.ZERO, c.getNumerator());
            assertEquals(BigInteger.TEN.pow(10), c.getDenominator());
            assertEquals("%fixed10(2, 10000000000)", fixed("0.00000000015"));
            assertEquals("%fixed10(12345678901, 10000000000)", fixed("1.234567890123"));
        }

        @Test
        @DisplayName("负数")
        void testNegative() {
            assertEquals("%fixed10(-25, 10)", fixed("-2.5"));
        }

        @Test
        @DisplayName("源码中的小数字面量")
        void testFromSource() {
            assertEquals("%fixed10(5, 10)", translate("0.5"));
        }
    }

    @Nested
    @DisplayName("其他字面量")
    class OtherTests {

        @Test
        @DisplayName("字符串与布尔值")
        void testStringAndBool() {
            assertEquals("\"hello\"", translate("'hello'"));
            assertEquals("true", translate("True"));
            assertEquals("false", translate("False"));
        }

        @Test
        @DisplayName("None 不支持")
        void testNone() {
            assertThatThrownBy(() -> translate("None"))
                    .isInstanceOf(UnsupportedConstructException.class)
                    .hasMessageContaining("None")
                    .extracting("kind").isEqualTo(UnsupportedConstructException.Kind.DETAIL);
        }
    }
}
