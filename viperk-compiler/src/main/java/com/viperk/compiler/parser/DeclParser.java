package com.viperk.compiler.parser;

import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.decl.Decorator;
import com.viperk.compiler.ast.decl.FunDecl;
import com.viperk.compiler.ast.decl.Parameter;
import com.viperk.compiler.ast.expr.Expression;
import com.viperk.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.viperk.compiler.lexer.TokenType.*;

/**
 * 函数声明解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析带装饰器的函数声明：({@code @expr NEWLINE})+ def ...
     */
    Statement parseDecorated() {
        SourceLocation loc = parser.location();
        List<Decorator> decorators = new ArrayList<Decorator>();
        while (parser.match(AT)) {
            SourceLocation decoLoc = parser.previousLocation();
            Expression expr = parser.parseExpression();
            parser.expect(NEWLINE, "Expected newline after decorator");
            decorators.add(new Decorator(decoLoc, expr));
        }
        if (!parser.check(KW_DEF)) {
            throw new ParseException("Decorator must be followed by a function definition", parser.current, "def");
        }
        return parseFunDecl(decorators, loc);
    }

    /**
     * def name(params) [-> returns]: suite
     */
    FunDecl parseFunDecl(List<Decorator> decorators, SourceLocation loc) {
        parser.expect(KW_DEF, "Expected 'def'");
        String name = parser.expect(IDENTIFIER, "Expected function name").getLexeme();

        parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = parseParameters();

        Expression returns = null;
        if (parser.match(ARROW)) {
            returns = parser.parseExpression();
        }

        parser.expect(COLON, "Expected ':' after function signature");
        List<Statement> body = parser.parseSuite();
        return new FunDecl(loc, decorators, name, params, returns, body);
    }

    private List<Parameter> parseParameters() {
        List<Parameter> params = new ArrayList<Parameter>();
        Set<String> seen = new HashSet<String>();
        boolean seenDefault = false;
        while (!parser.check(RPAREN)) {
            SourceLocation loc = parser.location();
            String name = parser.expect(IDENTIFIER, "Expected parameter name").getLexeme();
            if (!seen.add(name)) {
                throw new ParseException("Duplicate parameter '" + name + "'", parser.previous);
            }

            Expression annotation = null;
            if (parser.match(COLON)) {
                annotation = parser.parseExpression();
            }
            Expression defaultValue = null;
            if (parser.match(ASSIGN)) {
                defaultValue = parser.parseExpression();
                seenDefault = true;
            } else if (seenDefault) {
                throw new ParseException("Non-default parameter follows default parameter", parser.current);
            }

            params.add(new Parameter(loc, name, annotation, defaultValue));
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RPAREN, "Expected ')' after parameters");
        return params;
    }
}
