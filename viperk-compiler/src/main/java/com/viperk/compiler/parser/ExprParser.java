package com.viperk.compiler.parser;

import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.expr.*;
import com.viperk.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.viperk.compiler.ast.expr.BoolOpExpr.BoolOp;
import com.viperk.compiler.ast.expr.CollectionLiteral.CollectionKind;
import com.viperk.compiler.ast.expr.CompareExpr.CompareOp;
import com.viperk.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.viperk.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.viperk.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级由低到高：lambda → 条件表达式 → or → and → not → 比较 → | → ^ → &amp; → 移位 → 加减
 * → 乘除 → 一元 → ** → 后缀（调用/下标/属性）→ 原子。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        if (parser.check(KW_LAMBDA)) {
            return parseLambda();
        }
        SourceLocation loc = parser.location();
        Expression body = parseOrTest();
        if (!parser.match(KW_IF)) {
            return body;
        }
        Expression condition = parseOrTest();
        parser.expect(KW_ELSE, "Expected 'else' in conditional expression");
        return new ConditionalExpr(loc, body, condition, parseExpression());
    }

    // lambda 参数只取名字
    private Expression parseLambda() {
        SourceLocation loc = parser.location();
        parser.advance(); // 'lambda'
        List<String> params = new ArrayList<String>();
        while (parser.check(IDENTIFIER)) {
            params.add(parser.advance().getLexeme());
            if (!parser.match(COMMA)) break;
        }
        parser.expect(COLON, "Expected ':' after lambda parameters");
        return new LambdaExpr(loc, params, parseExpression());
    }

    /**
     * 逗号分隔的表达式列表；多于一个元素或带尾逗号时为元组
     */
    Expression parseTestList() {
        SourceLocation loc = parser.location();
        Expression first = parseExpression();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (!startsExpression()) break;
            elements.add(parseExpression());
        }
        return new CollectionLiteral(loc, CollectionKind.TUPLE, elements);
    }

    /**
     * for 循环目标：只解析到按位或层级，避免吞掉 'in'
     */
    Expression parseTargetList() {
        SourceLocation loc = parser.location();
        Expression first = parseBitOrExpr();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(KW_IN)) break;
            elements.add(parseBitOrExpr());
        }
        return new CollectionLiteral(loc, CollectionKind.TUPLE, elements);
    }

    // 逻辑或 or（操作数展平）
    private Expression parseOrTest() {
        SourceLocation loc = parser.location();
        Expression first = parseAndTest();
        if (!parser.check(KW_OR)) {
            return first;
        }
        List<Expression> values = new ArrayList<Expression>();
        values.add(first);
        while (parser.match(KW_OR)) {
            values.add(parseAndTest());
        }
        return new BoolOpExpr(loc, BoolOp.OR, values);
    }

    // 逻辑与 and（操作数展平）
    private Expression parseAndTest() {
        SourceLocation loc = parser.location();
        Expression first = parseNotTest();
        if (!parser.check(KW_AND)) {
            return first;
        }
        List<Expression> values = new ArrayList<Expression>();
        values.add(first);
        while (parser.match(KW_AND)) {
            values.add(parseNotTest());
        }
        return new BoolOpExpr(loc, BoolOp.AND, values);
    }

    // 逻辑非 not
    private Expression parseNotTest() {
        if (parser.match(KW_NOT)) {
            SourceLocation loc = parser.previousLocation();
            return new UnaryExpr(loc, UnaryOp.NOT, parseNotTest());
        }
        return parseComparison();
    }

    // 比较：保留链式形状，由下游决定是否支持
    private Expression parseComparison() {
        SourceLocation loc = parser.location();
        Expression left = parseBitOrExpr();

        List<CompareOp> operators = new ArrayList<CompareOp>();
        List<Expression> comparators = new ArrayList<Expression>();
        CompareOp op;
        while ((op = matchCompareOp()) != null) {
            operators.add(op);
            comparators.add(parseBitOrExpr());
        }

        if (operators.isEmpty()) {
            return left;
        }
        return new CompareExpr(loc, left, operators, comparators);
    }

    private CompareOp matchCompareOp() {
        switch (parser.current.getType()) {
            case EQ: parser.advance(); return CompareOp.EQ;
            case NE: parser.advance(); return CompareOp.NE;
            case LT: parser.advance(); return CompareOp.LT;
            case LE: parser.advance(); return CompareOp.LE;
            case GT: parser.advance(); return CompareOp.GT;
            case GE: parser.advance(); return CompareOp.GE;
            case KW_IN: parser.advance(); return CompareOp.IN;
            case KW_NOT:
                if (parser.checkAhead(KW_IN)) {
                    parser.advance();
                    parser.advance();
                    return CompareOp.NOT_IN;
                }
                return null;
            case KW_IS:
                parser.advance();
                return parser.match(KW_NOT) ? CompareOp.IS_NOT : CompareOp.IS;
            default:
                return null;
        }
    }

    // 按位或 |
    private Expression parseBitOrExpr() {
        Expression left = parseBitXorExpr();
        while (parser.match(PIPE)) {
            left = new BinaryExpr(left.getLocation(), left, BinaryOp.BIT_OR, parseBitXorExpr());
        }
        return left;
    }

    // 按位异或 ^
    private Expression parseBitXorExpr() {
        Expression left = parseBitAndExpr();
        while (parser.match(CARET)) {
            left = new BinaryExpr(left.getLocation(), left, BinaryOp.BIT_XOR, parseBitAndExpr());
        }
        return left;
    }

    // 按位与 &
    private Expression parseBitAndExpr() {
        Expression left = parseShiftExpr();
        while (parser.match(AMP)) {
            left = new BinaryExpr(left.getLocation(), left, BinaryOp.BIT_AND, parseShiftExpr());
        }
        return left;
    }

    // 移位 << >>
    private Expression parseShiftExpr() {
        Expression left = parseArithExpr();
        while (parser.checkAny(LSHIFT, RSHIFT)) {
            BinaryOp op = parser.advance().getType() == LSHIFT ? BinaryOp.LSHIFT : BinaryOp.RSHIFT;
            left = new BinaryExpr(left.getLocation(), left, op, parseArithExpr());
        }
        return left;
    }

    // 加减 + -
    private Expression parseArithExpr() {
        Expression left = parseTerm();
        while (parser.checkAny(PLUS, MINUS)) {
            BinaryOp op = parser.advance().getType() == PLUS ? BinaryOp.ADD : BinaryOp.SUB;
            left = new BinaryExpr(left.getLocation(), left, op, parseTerm());
        }
        return left;
    }

    // 乘除 * / // % @
    private Expression parseTerm() {
        Expression left = parseFactor();
        while (parser.checkAny(MUL, DIV, FLOOR_DIV, MOD, AT)) {
            Token op = parser.advance();
            BinaryOp binOp;
            switch (op.getType()) {
                case MUL: binOp = BinaryOp.MUL; break;
                case DIV: binOp = BinaryOp.DIV; break;
                case FLOOR_DIV: binOp = BinaryOp.FLOOR_DIV; break;
                case MOD: binOp = BinaryOp.MOD; break;
                case AT: binOp = BinaryOp.MATMUL; break;
                default: throw new ParseException("Unexpected operator", op);
            }
            left = new BinaryExpr(left.getLocation(), left, binOp, parseFactor());
        }
        return left;
    }

    // 一元 + - ~
    private Expression parseFactor() {
        if (parser.checkAny(PLUS, MINUS, TILDE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            UnaryOp unaryOp;
            switch (op.getType()) {
                case PLUS: unaryOp = UnaryOp.POS; break;
                case MINUS: unaryOp = UnaryOp.NEG; break;
                default: unaryOp = UnaryOp.INVERT; break;
            }
            return new UnaryExpr(loc, unaryOp, parseFactor());
        }
        return parsePower();
    }

    // 幂 **（右结合，右操作数可带一元前缀）
    private Expression parsePower() {
        Expression base = parsePostfix();
        if (parser.match(POW)) {
            return new BinaryExpr(base.getLocation(), base, BinaryOp.POW, parseFactor());
        }
        return base;
    }

    // 后缀：调用、下标、属性访问
    private Expression parsePostfix() {
        Expression expr = parseAtom();

        while (true) {
            if (parser.match(LPAREN)) {
                List<CallExpr.Argument> args = parseArguments();
                expr = new CallExpr(expr.getLocation(), expr, args);
            } else if (parser.match(LBRACKET)) {
                Expression index = parseSubscriptIndex();
                parser.expect(RBRACKET, "Expected ']' after subscript");
                expr = new SubscriptExpr(expr.getLocation(), expr, index);
            } else if (parser.match(DOT)) {
                String attr = expectAttributeName();
                expr = new AttributeExpr(expr.getLocation(), expr, attr);
            } else {
                break;
            }
        }

        return expr;
    }

    /**
     * 下标内容：单个表达式或切片，逗号分隔时为元组
     */
    private Expression parseSubscriptIndex() {
        SourceLocation loc = parser.location();
        Expression first = parseSliceItem();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACKET)) break;
            elements.add(parseSliceItem());
        }
        return new CollectionLiteral(loc, CollectionKind.TUPLE, elements);
    }

    private Expression parseSliceItem() {
        SourceLocation loc = parser.location();
        Expression lower = parser.check(COLON) ? null : parseExpression();
        if (!parser.match(COLON)) {
            return lower;
        }
        Expression upper = startsExpression() ? parseExpression() : null;
        Expression step = null;
        if (parser.match(COLON) && startsExpression()) {
            step = parseExpression();
        }
        return new SliceExpr(loc, lower, upper, step);
    }

    /**
     * 解析调用参数列表（'(' 已消费）：位置参数与 name=value 命名参数
     */
    private List<CallExpr.Argument> parseArguments() {
        List<CallExpr.Argument> args = new ArrayList<CallExpr.Argument>();
        boolean seenNamed = false;
        while (!parser.check(RPAREN)) {
            SourceLocation loc = parser.location();
            if (parser.check(IDENTIFIER) && parser.checkAhead(ASSIGN)) {
                String name = parser.advance().getLexeme();
                parser.advance(); // '='
                args.add(new CallExpr.Argument(loc, name, parseExpression()));
                seenNamed = true;
            } else {
                if (seenNamed) {
                    throw new ParseException("Positional argument follows keyword argument", parser.current);
                }
                args.add(new CallExpr.Argument(loc, null, parseExpression()));
            }
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }

    private String expectAttributeName() {
        return parser.expect(IDENTIFIER, "Expected attribute name after '.'").getLexeme();
    }

    // 原子
    private Expression parseAtom() {
        SourceLocation loc = parser.location();

        if (parser.checkAny(INT_LITERAL, FLOAT_LITERAL, STRING_LITERAL, KW_TRUE, KW_FALSE, KW_NONE)) {
            return parser.literalHelper.parseLiteral();
        }

        if (parser.check(IDENTIFIER)) {
            return new Name(loc, parser.advance().getLexeme());
        }

        // 括号：分组或元组
        if (parser.match(LPAREN)) {
            if (parser.match(RPAREN)) {
                return new CollectionLiteral(loc, CollectionKind.TUPLE, Collections.<Expression>emptyList());
            }
            Expression inner = parseTestList();
            parser.expect(RPAREN, "Expected ')'");
            return inner;
        }

        // 列表字面量
        if (parser.match(LBRACKET)) {
            List<Expression> elements = new ArrayList<Expression>();
            while (!parser.check(RBRACKET)) {
                elements.add(parseExpression());
                if (!parser.match(COMMA)) break;
            }
            parser.expect(RBRACKET, "Expected ']' after list elements");
            return new CollectionLiteral(loc, CollectionKind.LIST, elements);
        }

        // 字典字面量
        if (parser.match(LBRACE)) {
            List<DictLiteral.Entry> entries = new ArrayList<DictLiteral.Entry>();
            while (!parser.check(RBRACE)) {
                SourceLocation entryLoc = parser.location();
                Expression key = parseExpression();
                parser.expect(COLON, "Expected ':' after dict key");
                Expression value = parseExpression();
                entries.add(new DictLiteral.Entry(entryLoc, key, value));
                if (!parser.match(COMMA)) break;
            }
            parser.expect(RBRACE, "Expected '}' after dict entries");
            return new DictLiteral(loc, entries);
        }

        throw new ParseException("Expected expression", parser.current);
    }

    private boolean startsExpression() {
        return parser.checkAny(INT_LITERAL, FLOAT_LITERAL, STRING_LITERAL, KW_TRUE, KW_FALSE, KW_NONE,
                IDENTIFIER, LPAREN, LBRACKET, LBRACE, PLUS, MINUS, TILDE, KW_NOT, KW_LAMBDA);
    }
}
