package com.viperk.ir.translate;

import com.viperk.compiler.ast.decl.Program;
import com.viperk.compiler.lexer.Lexer;
import com.viperk.compiler.parser.Parser;
import com.viperk.ir.term.ProgramTerm;
import com.viperk.ir.translate.UnsupportedConstructException.Kind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * 程序组装测试
 */
class ProgramTranslatorTest {

    private ProgramTerm translate(String source) {
        Program program = new Parser(new Lexer(source, "<test>")).parse();
        return new ProgramTranslator(new SourceLines(source)).translate(program);
    }

    private UnsupportedConstructException failure(String source) {
        return assertThrows(UnsupportedConstructException.class, () -> translate(source));
    }

    @Nested
    @DisplayName("顶层分类")
    class ClassificationTests {

        @Test
        @DisplayName("事件、存储变量、构造函数、函数分别归类并保持源码顺序")
        void testSections() {
            String source = ""
                    + "Transfer: __log__({_from: indexed(address), _value: num256})\n"
                    + "total: public(num256)\n"
                    + "owner: address\n"
                    + "def __init__():\n"
                    + "    self.owner = msg.sender\n"
                    + "def b():\n"
                    + "    pass\n"
                    + "def a():\n"
                    + "    pass\n";
            ProgramTerm term = translate(source);
            assertEquals(1, term.getEvents().size());
            assertEquals(2, term.getGlobals().size());
            assertEquals(1, term.getInit().size());
            assertThat(term.getFunctions()).extracting("name").containsExactly("b", "a");
        }

        @Test
        @DisplayName("空程序")
        void testEmpty() {
            assertEquals("%pgm(, , , \n)", translate("").render());
            assertEquals("%pgm(, , , \n)", translate("# 只有注释\n\n").render());
        }

        @Test
        @DisplayName("顶层只允许声明与函数")
        void testTopLevelStatement() {
            UnsupportedConstructException e = failure("x = 1\n");
            assertEquals(Kind.STRUCTURAL, e.getKind());
            assertEquals(Kind.STRUCTURAL, failure("pass\n").getKind());
        }
    }

    @Nested
    @DisplayName("事件与存储变量")
    class DeclarationTests {

        @Test
        @DisplayName("事件参数的索引标记")
        void testEvent() {
            String ir = translate("Transfer: __log__({_from: indexed(address), _value: num256})\n").render();
            assertEquals("%pgm(\n  %event(Transfer, %eparam(_from, %address, true) %eparam(_value, %num256, false)), , , \n)",
                    ir);
        }

        @Test
        @DisplayName("可见性缺省为私有")
        void testVisibility() {
            String ir = translate("a: public(num)\nb: private(num)\nc: num[address]\n").render();
            assertEquals("%pgm(,\n  %svdecl(a, %num, %public)\n  %svdecl(b, %num, %private)"
                    + "\n  %svdecl(c, %mapT(%num, %address), %private), , \n)", ir);
        }

        @Test
        @DisplayName("单位类型不是可见性包装")
        void testUnitTypeGlobal() {
            String ir = translate("deadline: num(sec)\n").render();
            assertThat(ir).contains("%svdecl(deadline, %unitT(%num, %sec, false), %private)");
        }

        @Test
        @DisplayName("错误的事件与存储变量声明")
        void testDeclarationErrors() {
            assertEquals(Kind.DETAIL, failure("E: __log__(num)\n").getKind());
            assertEquals(Kind.DETAIL, failure("x: num = 1\n").getKind());
            assertEquals(Kind.DETAIL, failure("self.x: num\n").getKind());
            assertEquals(Kind.DETAIL, failure("x: public(num, bool)\n").getKind());
        }
    }

    @Nested
    @DisplayName("函数")
    class FunctionTests {

        @Test
        @DisplayName("装饰器、参数、返回类型与函数体缩进")
        void testFunction() {
            String source = ""
                    + "@public\n"
                    + "@constant\n"
                    + "def balanceOf(_owner: address) -> num256:\n"
                    + "    return self.balances[_owner]\n";
            assertEquals("%pgm(, , ,\n  %fdecl(%@public %@constant, balanceOf, %param(_owner, %address), %num256,"
                    + "\n    %return(%subscript(%svar(balances), %var(_owner))))\n)", translate(source).render());
        }

        @Test
        @DisplayName("无返回注解为 void，构造函数进入 INIT 分区")
        void testConstructor() {
            String source = "def __init__(_n: num):\n    self.n = _n\n";
            assertEquals("%pgm(, ,\n  %fdecl(, __init__, %param(_n, %num), %void,"
                    + "\n    %assign(%svar(n), %var(_n))), \n)", translate(source).render());
        }

        @Test
        @DisplayName("参数与装饰器的不支持形式")
        void testFunctionErrors() {
            assertEquals(Kind.DETAIL, failure("def f(a):\n    pass\n").getKind());
            assertEquals(Kind.DETAIL, failure("def f(a: num = 1):\n    pass\n").getKind());
            assertEquals(Kind.DETAIL, failure("@payable(1)\ndef f():\n    pass\n").getKind());
        }

        @Test
        @DisplayName("函数体内的错误终止整个翻译")
        void testBodyError() {
            UnsupportedConstructException e = failure("def f():\n    x = 1\n    while x:\n        pass\n");
            assertEquals(Kind.STRUCTURAL, e.getKind());
            assertEquals(3, e.getLocation().getLine());
        }
    }
}
