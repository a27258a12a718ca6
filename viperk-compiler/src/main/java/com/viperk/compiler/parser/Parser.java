package com.viperk.compiler.parser;

import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.decl.Decorator;
import com.viperk.compiler.ast.decl.Program;
import com.viperk.compiler.ast.expr.Expression;
import com.viperk.compiler.ast.stmt.Statement;
import com.viperk.compiler.lexer.Lexer;
import com.viperk.compiler.lexer.Token;
import com.viperk.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.viperk.compiler.lexer.TokenType.*;

/**
 * Viper 语法分析器（递归下降，Python 语法子集）
 *
 * <p>只负责把源码还原为通用语法树，不判断某个构造能否被翻译；
 * 语法错误立即抛出 {@link ParseException}。</p>
 */
public class Parser {

    final Lexer lexer;
    final String fileName;
    Token current;
    Token previous;
    private Token nextToken;  // 用于 lookahead 的缓冲

    // === Helper 实例 ===
    final LiteralHelper literalHelper = new LiteralHelper(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        advance();  // 读取第一个 token
    }

    public Parser(Lexer lexer) {
        this(lexer, lexer.getFileName());
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token；词法错误在此处转为解析异常
     */
    Token advance() {
        previous = current;
        if (nextToken != null) {
            current = nextToken;
            nextToken = null;
        } else {
            current = lexer.nextToken();
        }
        if (current.getType() == ERROR) {
            throw new ParseException("Lexer error: " + current.getValue(), current);
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        if (nextToken == null) {
            nextToken = lexer.nextToken();
        }
        return nextToken;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 向前看一个 token（不消费当前）
     */
    boolean checkAhead(TokenType type) {
        return peek().getType() == type;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return locationOf(previous);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(), token.getOffset());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 程序解析 ============

    /**
     * 解析整个模块
     */
    public Program parse() {
        SourceLocation loc = location();
        List<Statement> body = new ArrayList<Statement>();
        while (!isAtEnd()) {
            if (match(NEWLINE)) continue;
            if (check(INDENT)) {
                throw new ParseException("Unexpected indent", current);
            }
            body.addAll(parseStatement());
        }

        lexer.releaseSource(); // 解析完成，释放源码字符串
        return new Program(loc, body);
    }

    /**
     * 解析单个表达式（整段输入必须恰好是一个表达式）
     */
    public Expression parseStandaloneExpression() {
        Expression expr = parseExpression();
        while (match(NEWLINE)) {
            // 跳过
        }
        if (!isAtEnd()) {
            throw new ParseException("Unexpected token after expression", current);
        }
        lexer.releaseSource();
        return expr;
    }

    // ============ 解析委托 ============

    /** 一条逻辑行可能包含以 ';' 分隔的多条简单语句 */
    List<Statement> parseStatement() { return stmtParser.parseStatement(); }
    List<Statement> parseSuite() { return stmtParser.parseSuite(); }

    Statement parseDecorated() { return declParser.parseDecorated(); }
    Statement parseFunDecl() { return declParser.parseFunDecl(new ArrayList<Decorator>(), location()); }

    Expression parseExpression() { return exprParser.parseExpression(); }
    Expression parseTestList() { return exprParser.parseTestList(); }
}
