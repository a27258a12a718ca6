package com.viperk.compiler.pass;

import com.viperk.compiler.ast.decl.Program;
import com.viperk.compiler.ast.expr.BinaryExpr;
import com.viperk.compiler.ast.expr.Expression;
import com.viperk.compiler.ast.expr.Literal;
import com.viperk.compiler.ast.expr.Literal.LiteralKind;
import com.viperk.compiler.ast.expr.UnaryExpr;
import com.viperk.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.viperk.compiler.ast.stmt.AssignStmt;
import com.viperk.compiler.lexer.Lexer;
import com.viperk.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 负数字面量折叠测试
 */
class NegativeLiteralFolderTest {

    private Program fold(String source) {
        Program program = new Parser(new Lexer(source, "<test>")).parse();
        return new NegativeLiteralFolder(source).run(program);
    }

    private Expression valueOf(Program program) {
        return ((AssignStmt) program.getBody().get(0)).getValue();
    }

    @Test
    @DisplayName("负整数折叠为单个字面量")
    void testFoldInt() {
        Expression value = valueOf(fold("x = -5\n"));
        Literal lit = (Literal) value;
        assertEquals(LiteralKind.INT, lit.getKind());
        assertEquals(BigInteger.valueOf(-5), lit.intValue());
        assertEquals(6, lit.getLocation().getColumn());
    }

    @Test
    @DisplayName("负小数折叠")
    void testFoldDecimal() {
        Literal lit = (Literal) valueOf(fold("x = -2.5\n"));
        assertEquals(LiteralKind.DECIMAL, lit.getKind());
        assertEquals(new BigDecimal("-2.5"), lit.decimalValue());
    }

    @Test
    @DisplayName("十六进制写法不折叠")
    void testHexNotFolded() {
        UnaryExpr neg = (UnaryExpr) valueOf(fold("x = -0xff\n"));
        assertEquals(UnaryOp.NEG, neg.getOperator());
        assertEquals(BigInteger.valueOf(255), ((Literal) neg.getOperand()).intValue());
    }

    @Test
    @DisplayName("非字面量操作数保持不变")
    void testVariableNotFolded() {
        assertThat(valueOf(fold("x = -y\n"))).isInstanceOf(UnaryExpr.class);
    }

    @Test
    @DisplayName("双重取负整体保持原状")
    void testDoubleNegation() {
        UnaryExpr outer = (UnaryExpr) valueOf(fold("x = -(-5)\n"));
        assertEquals(UnaryOp.NEG, outer.getOperator());
        UnaryExpr inner = (UnaryExpr) outer.getOperand();
        assertEquals(BigInteger.valueOf(5), ((Literal) inner.getOperand()).intValue());
    }

    @Test
    @DisplayName("一元表达式之下不再折叠")
    void testNoFoldBelowUnary() {
        UnaryExpr neg = (UnaryExpr) valueOf(fold("x = -(y + -5)\n"));
        BinaryExpr add = (BinaryExpr) neg.getOperand();
        assertThat(add.getRight()).isInstanceOf(UnaryExpr.class);

        UnaryExpr not = (UnaryExpr) valueOf(fold("x = not -5\n"));
        assertThat(not.getOperand()).isInstanceOf(UnaryExpr.class);
    }

    @Test
    @DisplayName("嵌套在二元表达式中的负数")
    void testNestedInBinary() {
        BinaryExpr add = (BinaryExpr) valueOf(fold("x = a + -1\n"));
        assertThat(add.getRight()).isInstanceOf(Literal.class);
    }

    @Test
    @DisplayName("无变化时返回同一棵树")
    void testUnchangedTreeIsSameInstance() {
        Program program = new Parser(new Lexer("x = y + 1\n", "<test>")).parse();
        assertSame(program, new NegativeLiteralFolder("x = y + 1\n").run(program));
    }

    @Test
    @DisplayName("pass 名称")
    void testName() {
        assertEquals("NegativeLiteralFolder", new NegativeLiteralFolder(null).getName());
    }
}
