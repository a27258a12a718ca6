package com.viperk.compiler.parser;

import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.expr.Expression;
import com.viperk.compiler.ast.expr.Literal;
import com.viperk.compiler.ast.expr.Literal.LiteralKind;
import com.viperk.compiler.lexer.Token;

import static com.viperk.compiler.lexer.TokenType.*;

/**
 * 字面量解析辅助类：把字面量 token 转换为 {@link Literal} 节点
 *
 * <p>整数与小数保留任意精度（BigInteger / BigDecimal），十六进制等进制信息
 * 不进入语法树，下游需要时回查源码。</p>
 */
class LiteralHelper {

    final Parser parser;

    LiteralHelper(Parser parser) {
        this.parser = parser;
    }

    Expression parseLiteral() {
        Token token = parser.advance();
        SourceLocation loc = parser.locationOf(token);

        switch (token.getType()) {
            case INT_LITERAL:
                return new Literal(loc, token.getValue(), LiteralKind.INT);
            case FLOAT_LITERAL:
                return new Literal(loc, token.getValue(), LiteralKind.DECIMAL);
            case STRING_LITERAL:
                return new Literal(loc, concatAdjacentStrings((String) token.getValue()), LiteralKind.STRING);
            case KW_TRUE:
                return new Literal(loc, Boolean.TRUE, LiteralKind.BOOLEAN);
            case KW_FALSE:
                return new Literal(loc, Boolean.FALSE, LiteralKind.BOOLEAN);
            case KW_NONE:
                return new Literal(loc, null, LiteralKind.NONE);
            default:
                throw new ParseException("Expected literal", token);
        }
    }

    /**
     * 相邻字符串字面量在编译期拼接："a" "b" → "ab"
     */
    private String concatAdjacentStrings(String first) {
        if (!parser.check(STRING_LITERAL)) {
            return first;
        }
        StringBuilder sb = new StringBuilder(first);
        while (parser.check(STRING_LITERAL)) {
            sb.append((String) parser.advance().getValue());
        }
        return sb.toString();
    }
}
