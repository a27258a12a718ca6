package com.viperk.ir.translate;

import com.viperk.compiler.ast.expr.Expression;
import com.viperk.compiler.lexer.Lexer;
import com.viperk.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 类型注解翻译测试
 */
class TypeTranslatorTest {

    private static TypeTranslator translatorFor(String source) {
        return new TypeTranslator(new ConstTranslator(new SourceLines(source)));
    }

    private static Expression parse(String source) {
        return new Parser(new Lexer(source, "<test>")).parseStandaloneExpression();
    }

    private String type(String source) {
        return translatorFor(source).translate(parse(source)).render();
    }

    @Nested
    @DisplayName("基本形状")
    class ShapeTests {

        @Test
        @DisplayName("名称为基础类型，不做检查")
        void testBase() {
            assertEquals("%num", type("num"));
            assertEquals("%anything_goes", type("anything_goes"));
        }

        @Test
        @DisplayName("省略的类型为 void")
        void testVoid() {
            assertEquals("%void", translatorFor("").translate(null).render());
        }

        @Test
        @DisplayName("整数下标为列表，类型下标为映射")
        void testListAndMap() {
            assertEquals("%listT(%num, 5)", type("num[5]"));
            assertEquals("%mapT(%num, %address)", type("num[address]"));
            assertEquals("%mapT(%listT(%num, 3), %address)", type("num[3][address]"));
        }

        @Test
        @DisplayName("十六进制列表长度保留原写法")
        void testHexListLength() {
            assertEquals("%listT(%num, %hex(\"10\"))", type("num[0x10]"));
            assertEquals("%listT(%address, %hex(\"Ff\"))", type("address[0xFf]"));
        }

        @Test
        @DisplayName("bytes <= N 为字节数组")
        void testByteArray() {
            assertEquals("%bytesT(32)", type("bytes <= 32"));
        }

        @Test
        @DisplayName("字典为结构体")
        void testStruct() {
            assertEquals("%structT(%vdecl(a, %num) %vdecl(b, %mapT(%bool, %address)))",
                    type("{a: num, b: bool[address]}"));
        }
    }

    @Nested
    @DisplayName("单位类型")
    class UnitTests {

        @Test
        @DisplayName("基本单位与组合")
        void testUnits() {
            assertEquals("%unitT(%num, %wei, false)", type("num(wei)"));
            assertEquals("%unitT(%decimal, %udiv(%wei, %sec), false)", type("decimal(wei / sec)"));
            assertEquals("%unitT(%num, %umul(%wei, %sec), false)", type("num(wei * sec)"));
            assertEquals("%unitT(%num, %upow(%sec, 2), false)", type("num(sec ** 2)"));
        }

        @Test
        @DisplayName("positional 标记")
        void testPositional() {
            assertEquals("%unitT(%num, %sec, true)", type("num(sec, positional)"));
        }

        @Test
        @DisplayName("单位中的其他运算符不支持")
        void testBadOperator() {
            assertThatThrownBy(() -> type("num(wei + sec)"))
                    .isInstanceOf(UnsupportedConstructException.class)
                    .hasMessageContaining("'+'");
        }

        @Test
        @DisplayName("指数必须是整数字面量")
        void testBadExponent() {
            assertThatThrownBy(() -> type("num(sec ** n)"))
                    .isInstanceOf(UnsupportedConstructException.class)
                    .hasMessageContaining("exponent");
        }

        @Test
        @DisplayName("基类型只能是 num 或 decimal")
        void testBadBase() {
            assertThatThrownBy(() -> type("address(wei)"))
                    .isInstanceOf(UnsupportedConstructException.class);
        }
    }

    @Nested
    @DisplayName("不支持的形状")
    class ErrorTests {

        @ParameterizedTest
        @ValueSource(strings = {"bytes < 32", "bytes <= n", "a.b", "[num]", "bytes <= 3 <= 4", "num[1:2]"})
        @DisplayName("无法识别的注解")
        void testUnsupported(String source) {
            assertThatThrownBy(() -> type(source)).isInstanceOf(UnsupportedConstructException.class);
        }

        @Test
        @DisplayName("结构体字段名必须是名称")
        void testStructKey() {
            assertThatThrownBy(() -> type("{'a': num}"))
                    .isInstanceOf(UnsupportedConstructException.class)
                    .extracting("kind").isEqualTo(UnsupportedConstructException.Kind.DETAIL);
        }
    }
}
