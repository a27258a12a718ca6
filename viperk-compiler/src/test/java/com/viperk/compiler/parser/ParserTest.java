package com.viperk.compiler.parser;

import com.viperk.compiler.ast.decl.FunDecl;
import com.viperk.compiler.ast.decl.Program;
import com.viperk.compiler.ast.expr.*;
import com.viperk.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.viperk.compiler.ast.expr.CompareExpr.CompareOp;
import com.viperk.compiler.ast.expr.Literal.LiteralKind;
import com.viperk.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.viperk.compiler.ast.stmt.*;
import com.viperk.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Program parse(String source) {
        return new Parser(new Lexer(source, "<test>")).parse();
    }

    private List<Statement> body(String source) {
        return parse(source).getBody();
    }

    private Expression expr(String source) {
        return new Parser(new Lexer(source, "<test>")).parseStandaloneExpression();
    }

    // ================================================================
    // 表达式
    // ================================================================

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpr add = (BinaryExpr) expr("a + b * c");
            assertEquals(BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryOp.MUL, ((BinaryExpr) add.getRight()).getOperator());
        }

        @Test
        @DisplayName("幂运算右结合且高于一元负号")
        void testPower() {
            UnaryExpr neg = (UnaryExpr) expr("-a ** b ** c");
            assertEquals(UnaryOp.NEG, neg.getOperator());
            BinaryExpr pow = (BinaryExpr) neg.getOperand();
            assertEquals(BinaryOp.POW, pow.getOperator());
            assertThat(pow.getRight()).isInstanceOf(BinaryExpr.class);
        }

        @Test
        @DisplayName("链式比较保留为一个节点")
        void testChainedComparison() {
            CompareExpr cmp = (CompareExpr) expr("a < b <= c");
            assertTrue(cmp.isChained());
            assertThat(cmp.getOperators()).containsExactly(CompareOp.LT, CompareOp.LE);
        }

        @Test
        @DisplayName("not in / is not")
        void testNegatedComparisons() {
            assertThat(((CompareExpr) expr("a not in b")).getOperators()).containsExactly(CompareOp.NOT_IN);
            assertThat(((CompareExpr) expr("a is not b")).getOperators()).containsExactly(CompareOp.IS_NOT);
        }

        @Test
        @DisplayName("布尔运算操作数展平")
        void testBoolOpFlatten() {
            BoolOpExpr or = (BoolOpExpr) expr("a or b or c");
            assertEquals(3, or.getValues().size());
        }

        @Test
        @DisplayName("属性、下标、调用组成后缀链")
        void testPostfixChain() {
            CallExpr call = (CallExpr) expr("self.balances[msg.sender].get(1, key=2)");
            AttributeExpr get = (AttributeExpr) call.getCallee();
            assertEquals("get", get.getAttr());
            assertThat(get.getTarget()).isInstanceOf(SubscriptExpr.class);
            assertTrue(call.hasNamedArgs());
            assertEquals(1, call.getPositionalValues().size());
        }

        @Test
        @DisplayName("列表、元组与字典字面量")
        void testCollections() {
            assertEquals(CollectionLiteral.CollectionKind.LIST, ((CollectionLiteral) expr("[1, 2]")).getKind());
            assertEquals(CollectionLiteral.CollectionKind.TUPLE, ((CollectionLiteral) expr("(1, 2)")).getKind());
            assertEquals(2, ((DictLiteral) expr("{a: num, b: bool}")).getEntries().size());
        }

        @Test
        @DisplayName("相邻字符串在编译期拼接")
        void testAdjacentStrings() {
            Literal lit = (Literal) expr("\"ab\" 'cd'");
            assertEquals(LiteralKind.STRING, lit.getKind());
            assertEquals("abcd", lit.stringValue());
        }

        @Test
        @DisplayName("切片下标")
        void testSlice() {
            SubscriptExpr sub = (SubscriptExpr) expr("y[1:2]");
            SliceExpr slice = (SliceExpr) sub.getIndex();
            assertEquals(BigInteger.ONE, ((Literal) slice.getLower()).intValue());
            assertEquals(BigInteger.valueOf(2), ((Literal) slice.getUpper()).intValue());
            assertNull(slice.getStep());

            SliceExpr open = (SliceExpr) ((SubscriptExpr) expr("y[::3]")).getIndex();
            assertNull(open.getLower());
            assertNull(open.getUpper());
            assertEquals(BigInteger.valueOf(3), ((Literal) open.getStep()).intValue());

            CollectionLiteral multi = (CollectionLiteral) ((SubscriptExpr) expr("y[a, 1:]")).getIndex();
            assertThat(multi.getElements().get(1)).isInstanceOf(SliceExpr.class);
        }

        @Test
        @DisplayName("条件表达式右结合")
        void testConditional() {
            ConditionalExpr cond = (ConditionalExpr) expr("a if b else c if d else e");
            assertEquals("a", ((Name) cond.getBody()).getId());
            assertEquals("b", ((Name) cond.getCondition()).getId());
            assertThat(cond.getOrElse()).isInstanceOf(ConditionalExpr.class);
        }

        @Test
        @DisplayName("lambda 表达式")
        void testLambda() {
            LambdaExpr lambda = (LambdaExpr) expr("lambda x, y: x + y");
            assertThat(lambda.getParams()).containsExactly("x", "y");
            assertThat(lambda.getBody()).isInstanceOf(BinaryExpr.class);
            assertThat(((LambdaExpr) expr("lambda: 0")).getParams()).isEmpty();
        }

        @Test
        @DisplayName("字面量位置指向数字本身")
        void testLiteralLocation() {
            UnaryExpr neg = (UnaryExpr) expr("-0xff");
            Literal lit = (Literal) neg.getOperand();
            assertEquals(BigInteger.valueOf(255), lit.intValue());
            assertEquals(2, lit.getLocation().getColumn());
            assertEquals(1, lit.getLocation().getOffset());
        }
    }

    // ================================================================
    // 语句
    // ================================================================

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("注解声明")
        void testAnnAssign() {
            AnnAssignStmt decl = (AnnAssignStmt) body("x: num[address]").get(0);
            assertEquals("x", ((Name) decl.getTarget()).getId());
            assertThat(decl.getAnnotation()).isInstanceOf(SubscriptExpr.class);
            assertFalse(decl.hasValue());
        }

        @Test
        @DisplayName("赋值与增强赋值")
        void testAssignments() {
            List<Statement> stmts = body("a = b = 1\nc -= 2\n");
            assertEquals(2, ((AssignStmt) stmts.get(0)).getTargets().size());
            assertEquals(BinaryOp.SUB, ((AugAssignStmt) stmts.get(1)).getOperator());
        }

        @Test
        @DisplayName("elif 展开为嵌套 if")
        void testElif() {
            IfStmt stmt = (IfStmt) body("if a:\n    pass\nelif b:\n    pass\nelse:\n    break\n").get(0);
            assertEquals(1, stmt.getOrElse().size());
            IfStmt nested = (IfStmt) stmt.getOrElse().get(0);
            assertTrue(nested.hasElse());
            assertThat(nested.getOrElse().get(0)).isInstanceOf(BreakStmt.class);
        }

        @Test
        @DisplayName("for 循环与单行语句块")
        void testForLoop() {
            ForStmt loop = (ForStmt) body("for i in range(10): pass").get(0);
            assertEquals("i", ((Name) loop.getTarget()).getId());
            assertTrue(((CallExpr) loop.getIterable()).isCallTo("range"));
            assertThat(loop.getBody()).hasSize(1).first().isInstanceOf(PassStmt.class);
        }

        @Test
        @DisplayName("循环的 else 子句")
        void testLoopElse() {
            ForStmt loop = (ForStmt) body("for i in x:\n    pass\nelse:\n    break\n").get(0);
            assertTrue(loop.hasElse());
            assertThat(loop.getOrElse()).hasSize(1).first().isInstanceOf(BreakStmt.class);

            WhileStmt whileLoop = (WhileStmt) body("while a:\n    pass\nelse: pass\n").get(0);
            assertTrue(whileLoop.hasElse());
            assertFalse(((ForStmt) body("for i in x: pass").get(0)).hasElse());
        }

        @Test
        @DisplayName("分号分隔的简单语句")
        void testSemicolons() {
            assertEquals(3, body("x = 1; y = 2; pass\n").size());
        }

        @Test
        @DisplayName("return / assert / raise")
        void testSmallStatements() {
            List<Statement> stmts = body("return\nreturn x\nassert x, \"msg\"\nraise\n");
            assertFalse(((ReturnStmt) stmts.get(0)).hasValue());
            assertTrue(((ReturnStmt) stmts.get(1)).hasValue());
            assertTrue(((AssertStmt) stmts.get(2)).hasMessage());
            assertThat(stmts.get(3)).isInstanceOf(RaiseStmt.class);
        }

        @Test
        @DisplayName("带装饰器与注解的函数定义")
        void testFunDecl() {
            FunDecl fun = (FunDecl) body("@public\n@constant\ndef f(a: num, b: address) -> bool:\n    return True\n").get(0);
            assertEquals("f", fun.getName());
            assertEquals(2, fun.getDecorators().size());
            assertEquals(2, fun.getParams().size());
            assertTrue(fun.getParams().get(1).hasAnnotation());
            assertTrue(fun.hasReturns());
            assertEquals(1, fun.getBody().size());
        }
    }

    // ================================================================
    // 错误
    // ================================================================

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("缺少冒号")
        void testMissingColon() {
            assertThatThrownBy(() -> parse("if a\n    pass\n"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Expected ':'")
                    .hasMessageContaining("line 1");
        }

        @Test
        @DisplayName("意外缩进")
        void testUnexpectedIndent() {
            assertThatThrownBy(() -> parse("    x = 1\n"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Unexpected indent");
        }

        @Test
        @DisplayName("词法错误转为解析异常")
        void testLexerError() {
            ByteArrayOutputStream sink = new ByteArrayOutputStream();
            Lexer lexer = new Lexer("x = $\n", "<test>", new PrintStream(sink, true, StandardCharsets.UTF_8));
            ParseException e = assertThrows(ParseException.class, () -> new Parser(lexer).parse());
            assertThat(e.getMessage()).contains("Lexer error");
            assertEquals(1, e.getLine());
        }

        @Test
        @DisplayName("装饰器后必须是函数定义")
        void testDecoratorWithoutDef() {
            assertThatThrownBy(() -> parse("@public\nx = 1\n"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Decorator must be followed");
        }

        @Test
        @DisplayName("条件表达式缺少 else")
        void testConditionalWithoutElse() {
            assertThatThrownBy(() -> expr("a if b"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Expected 'else'");
        }
    }
}
