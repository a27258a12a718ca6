package com.viperk.compiler.parser;

import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.viperk.compiler.ast.expr.Expression;
import com.viperk.compiler.ast.stmt.*;
import com.viperk.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.viperk.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析一条语句：复合语句，或一行以 ';' 分隔的简单语句
     */
    List<Statement> parseStatement() {
        if (parser.check(KW_IF)) {
            return Collections.<Statement>singletonList(parseIfStmt());
        }
        if (parser.check(KW_FOR)) {
            return Collections.<Statement>singletonList(parseForStmt());
        }
        if (parser.check(KW_WHILE)) {
            return Collections.<Statement>singletonList(parseWhileStmt());
        }
        if (parser.check(AT)) {
            return Collections.singletonList(parser.parseDecorated());
        }
        if (parser.check(KW_DEF)) {
            return Collections.singletonList(parser.parseFunDecl());
        }
        return parseSimpleStatements();
    }

    /**
     * 解析语句块：同一行的简单语句，或 NEWLINE INDENT stmt+ DEDENT
     */
    List<Statement> parseSuite() {
        if (!parser.match(NEWLINE)) {
            return parseSimpleStatements();
        }
        while (parser.match(NEWLINE)) {
            // 跳过
        }
        parser.expect(INDENT, "Expected an indented block");
        List<Statement> body = new ArrayList<Statement>();
        while (!parser.check(DEDENT) && !parser.isAtEnd()) {
            if (parser.match(NEWLINE)) continue;
            body.addAll(parseStatement());
        }
        parser.expect(DEDENT, "Expected end of indented block");
        return body;
    }

    private List<Statement> parseSimpleStatements() {
        List<Statement> stmts = new ArrayList<Statement>();
        stmts.add(parseSmallStatement());
        while (parser.match(SEMICOLON)) {
            if (parser.check(NEWLINE)) break;
            stmts.add(parseSmallStatement());
        }
        if (!parser.match(NEWLINE) && !parser.isAtEnd()) {
            throw new ParseException("Expected end of line", parser.current, "NEWLINE");
        }
        return stmts;
    }

    private Statement parseSmallStatement() {
        SourceLocation loc = parser.location();

        if (parser.match(KW_PASS)) {
            return new PassStmt(loc);
        }
        if (parser.match(KW_BREAK)) {
            return new BreakStmt(loc);
        }
        if (parser.match(KW_CONTINUE)) {
            return new ContinueStmt(loc);
        }
        if (parser.match(KW_RETURN)) {
            Expression value = atStatementEnd() ? null : parser.parseTestList();
            return new ReturnStmt(loc, value);
        }
        if (parser.match(KW_RAISE)) {
            Expression exception = atStatementEnd() ? null : parser.parseExpression();
            return new RaiseStmt(loc, exception);
        }
        if (parser.match(KW_ASSERT)) {
            Expression test = parser.parseExpression();
            Expression message = null;
            if (parser.match(COMMA)) {
                message = parser.parseExpression();
            }
            return new AssertStmt(loc, test, message);
        }
        if (parser.checkAny(KW_DEF, KW_IF, KW_FOR, KW_WHILE, AT)) {
            throw new ParseException("Compound statement not allowed here", parser.current);
        }

        return parseExpressionStatement(loc);
    }

    /**
     * 以表达式开头的语句：注解声明、赋值、增强赋值或表达式语句
     */
    private Statement parseExpressionStatement(SourceLocation loc) {
        Expression first = parser.parseTestList();

        // 注解声明 target: annotation [= value]
        if (parser.match(COLON)) {
            Expression annotation = parser.parseExpression();
            Expression value = null;
            if (parser.match(ASSIGN)) {
                value = parser.parseTestList();
            }
            return new AnnAssignStmt(loc, first, annotation, value);
        }

        // 增强赋值
        if (parser.current.getType().isAugmentedAssignOp()) {
            Token op = parser.advance();
            Expression value = parser.parseTestList();
            return new AugAssignStmt(loc, first, augmentedOperator(op), value);
        }

        // 赋值（支持链式 a = b = value）
        if (parser.check(ASSIGN)) {
            List<Expression> targets = new ArrayList<Expression>();
            Expression value = first;
            while (parser.match(ASSIGN)) {
                targets.add(value);
                value = parser.parseTestList();
            }
            return new AssignStmt(loc, targets, value);
        }

        return new ExpressionStmt(loc, first);
    }

    private BinaryOp augmentedOperator(Token op) {
        switch (op.getType()) {
            case PLUS_ASSIGN: return BinaryOp.ADD;
            case MINUS_ASSIGN: return BinaryOp.SUB;
            case MUL_ASSIGN: return BinaryOp.MUL;
            case DIV_ASSIGN: return BinaryOp.DIV;
            case FLOOR_DIV_ASSIGN: return BinaryOp.FLOOR_DIV;
            case MOD_ASSIGN: return BinaryOp.MOD;
            case POW_ASSIGN: return BinaryOp.POW;
            case MATMUL_ASSIGN: return BinaryOp.MATMUL;
            case AMP_ASSIGN: return BinaryOp.BIT_AND;
            case PIPE_ASSIGN: return BinaryOp.BIT_OR;
            case CARET_ASSIGN: return BinaryOp.BIT_XOR;
            case LSHIFT_ASSIGN: return BinaryOp.LSHIFT;
            case RSHIFT_ASSIGN: return BinaryOp.RSHIFT;
            default: throw new ParseException("Unexpected assignment operator", op);
        }
    }

    private boolean atStatementEnd() {
        return parser.checkAny(NEWLINE, SEMICOLON, EOF);
    }

    // ============ 复合语句 ============

    private Statement parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.advance(); // 'if' 或 'elif'
        Expression condition = parser.parseExpression();
        parser.expect(COLON, "Expected ':' after if condition");
        List<Statement> body = parser.parseSuite();

        List<Statement> orElse;
        if (parser.check(KW_ELIF)) {
            orElse = Collections.singletonList(parseIfStmt());
        } else if (parser.match(KW_ELSE)) {
            parser.expect(COLON, "Expected ':' after 'else'");
            orElse = parser.parseSuite();
        } else {
            orElse = Collections.emptyList();
        }
        return new IfStmt(loc, condition, body, orElse);
    }

    private Statement parseForStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FOR, "Expected 'for'");
        Expression target = parser.exprParser.parseTargetList();
        parser.expect(KW_IN, "Expected 'in' in for statement");
        Expression iterable = parser.parseTestList();
        parser.expect(COLON, "Expected ':' after for clause");
        List<Statement> body = parser.parseSuite();
        return new ForStmt(loc, target, iterable, body, parseLoopElse());
    }

    private Statement parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "Expected 'while'");
        Expression condition = parser.parseExpression();
        parser.expect(COLON, "Expected ':' after while condition");
        List<Statement> body = parser.parseSuite();
        return new WhileStmt(loc, condition, body, parseLoopElse());
    }

    /** 循环末尾可选的 else 子句 */
    private List<Statement> parseLoopElse() {
        if (!parser.match(KW_ELSE)) {
            return Collections.emptyList();
        }
        parser.expect(COLON, "Expected ':' after 'else'");
        return parser.parseSuite();
    }
}
