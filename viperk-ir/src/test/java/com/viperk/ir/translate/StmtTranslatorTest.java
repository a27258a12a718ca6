package com.viperk.ir.translate;

import com.viperk.compiler.ast.decl.Program;
import com.viperk.compiler.lexer.Lexer;
import com.viperk.compiler.parser.Parser;
import com.viperk.ir.translate.UnsupportedConstructException.Kind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * 语句翻译测试：语句块位于函数体层级（depth 2）
 */
class StmtTranslatorTest {

    private String translate(String source) {
        Program program = new Parser(new Lexer(source, "<test>")).parse();
        ConstTranslator consts = new ConstTranslator(new SourceLines(source));
        TypeTranslator types = new TypeTranslator(consts);
        ExprTranslator exprs = new ExprTranslator(consts);
        return new StmtTranslator(exprs, types).translateBlock(program.getBody(), 2).render();
    }

    private UnsupportedConstructException failure(String source) {
        return assertThrows(UnsupportedConstructException.class, () -> translate(source));
    }

    @Nested
    @DisplayName("声明与赋值")
    class AssignmentTests {

        @Test
        @DisplayName("局部变量声明")
        void testVarDecl() {
            assertEquals("\n    %vdecl(x, %num)", translate("x: num\n"));
            assertEquals("\n    %vdecl(m, %mapT(%num, %address))", translate("m: num[address]\n"));
        }

        @Test
        @DisplayName("赋值与增强赋值")
        void testAssign() {
            assertEquals("\n    %assign(%subscript(%svar(balances), %var(_sender)), "
                            + "%num256_add(%subscript(%svar(balances), %var(_sender)), %var(_value)))",
                    translate("self.balances[_sender] = num256_add(self.balances[_sender], _value)\n"));
            assertEquals("\n    %augassign(-=, %svar(total), 1)", translate("self.total -= 1\n"));
            assertEquals("\n    %augassign(//=, %var(x), 2)", translate("x //= 2\n"));
        }

        @Test
        @DisplayName("赋值的不支持形式")
        void testAssignErrors() {
            assertEquals(Kind.DETAIL, failure("a = b = 1\n").getKind());
            assertEquals(Kind.DETAIL, failure("f(x) = 1\n").getKind());
            assertEquals(Kind.DETAIL, failure("x: num = 1\n").getKind());
            assertEquals(Kind.DETAIL, failure("x: public(num)\n").getKind());
            assertEquals(Kind.DETAIL, failure("a, b = 1\n").getKind());
        }
    }

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("if 的语句块位于下一层")
        void testIf() {
            assertEquals("\n    %if(%var(a),\n      %pass)", translate("if a:\n    pass\n"));
        }

        @Test
        @DisplayName("elif 嵌套在 else 块中")
        void testElif() {
            String expected = "\n    %if(%var(a),\n      %pass,"
                    + "\n      %if(%var(b),\n        %break,\n        %throw))";
            assertEquals(expected, translate("if a:\n    pass\nelif b:\n    break\nelse:\n    throw\n"));
        }

        @Test
        @DisplayName("range 循环")
        void testForRange() {
            assertEquals("\n    %forrange(i, 10,\n      %pass)", translate("for i in range(10):\n    pass\n"));
            assertEquals("\n    %forrange(i, %var(a), %binop(+, %var(a), 5),\n      %pass)",
                    translate("for i in range(a, a + 5):\n    pass\n"));
        }

        @Test
        @DisplayName("遍历列表")
        void testForIter() {
            assertEquals("\n    %forlist(x, %svar(items),\n      %assign(%var(y), %var(x)))",
                    translate("for x in self.items:\n    y = x\n"));
        }

        @Test
        @DisplayName("range 参数个数错误")
        void testRangeArity() {
            assertEquals(Kind.DETAIL, failure("for i in range():\n    pass\n").getKind());
            assertEquals(Kind.DETAIL, failure("for i in range(1, 2, 3):\n    pass\n").getKind());
        }

        @Test
        @DisplayName("循环变量必须是名称")
        void testLoopTarget() {
            assertEquals(Kind.DETAIL, failure("for a, b in xs:\n    pass\n").getKind());
        }

        @Test
        @DisplayName("return / assert")
        void testReturnAndAssert() {
            assertEquals("\n    %return\n    %return(%var(x))", translate("return\nreturn x\n"));
            assertEquals("\n    %assert(%compareop(%gt, %var(x), 0))", translate("assert x > 0\n"));
            assertEquals(Kind.DETAIL, failure("assert x, 'bad'\n").getKind());
        }

        @Test
        @DisplayName("不支持的控制流语句")
        void testUnsupportedControlFlow() {
            assertEquals(Kind.STRUCTURAL, failure("while a:\n    pass\n").getKind());
            assertEquals(Kind.STRUCTURAL, failure("continue\n").getKind());
            assertEquals(Kind.STRUCTURAL, failure("raise\n").getKind());
            assertEquals(Kind.STRUCTURAL, failure("def f():\n    pass\n").getKind());
            assertEquals(Kind.STRUCTURAL, failure("while a:\n    pass\nelse:\n    pass\n").getKind());
        }

        @Test
        @DisplayName("for ... else 不支持")
        void testForElse() {
            UnsupportedConstructException e =
                    failure("for i in range(3):\n    pass\nelse:\n    x = 1\n");
            assertEquals(Kind.STRUCTURAL, e.getKind());
            assertThat(e.getMessage()).contains("for ... else");
        }
    }

    @Nested
    @DisplayName("表达式语句")
    class ExpressionStatementTests {

        @Test
        @DisplayName("log、send、selfdestruct、throw")
        void testSpecialCalls() {
            assertEquals("\n    %log(Transfer, %msg.sender %var(_to) %var(_value))",
                    translate("log.Transfer(msg.sender, _to, _value)\n"));
            assertEquals("\n    %send(%var(to), %msg.value)", translate("send(to, msg.value)\n"));
            assertEquals("\n    %selfdestruct(%svar(owner))", translate("selfdestruct(self.owner)\n"));
            assertEquals("\n    %throw", translate("throw\n"));
        }

        @Test
        @DisplayName("参数个数错误")
        void testArity() {
            assertEquals(Kind.DETAIL, failure("send(to)\n").getKind());
            assertEquals(Kind.DETAIL, failure("selfdestruct()\n").getKind());
        }

        @Test
        @DisplayName("其他调用语句不支持")
        void testOtherCalls() {
            UnsupportedConstructException e = failure("x = 1\nfoo(1)\n");
            assertEquals(Kind.STRUCTURAL, e.getKind());
            assertEquals(2, e.getLocation().getLine());
            assertThat(e.getMessage()).contains("line 2");
        }
    }
}
