package com.viperk.compiler.lexer;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Viper 词法分析器
 *
 * <p>按 Python 规则处理缩进：逻辑行首的缩进变化产生 INDENT/DEDENT，
 * 括号内的换行被忽略，空行和纯注释行不产生 token。</p>
 */
public class Lexer {
    private static final int TAB_SIZE = 8;

    private String source;  // non-final: 解析完成后可释放
    private final String fileName;
    private final Deque<Token> pending = new ArrayDeque<Token>();
    private final Deque<Integer> indentStack = new ArrayDeque<Integer>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    private int bracketDepth = 0;
    private boolean atLineStart = true;
    private boolean finished = false;
    private Token lastEmitted;

    private final PrintStream errStream;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        map.put("def", TokenType.KW_DEF);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("elif", TokenType.KW_ELIF);
        map.put("else", TokenType.KW_ELSE);
        map.put("for", TokenType.KW_FOR);
        map.put("while", TokenType.KW_WHILE);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("pass", TokenType.KW_PASS);
        map.put("return", TokenType.KW_RETURN);
        map.put("assert", TokenType.KW_ASSERT);
        map.put("raise", TokenType.KW_RAISE);
        map.put("lambda", TokenType.KW_LAMBDA);
        // "throw"/"log"/"self" 是普通标识符，由翻译器按形状识别

        // 运算
        map.put("and", TokenType.KW_AND);
        map.put("or", TokenType.KW_OR);
        map.put("not", TokenType.KW_NOT);
        map.put("in", TokenType.KW_IN);
        map.put("is", TokenType.KW_IS);

        // 常量
        map.put("True", TokenType.KW_TRUE);
        map.put("False", TokenType.KW_FALSE);
        map.put("None", TokenType.KW_NONE);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, System.err);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
        this.indentStack.push(0);
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /** 释放源码字符串引用（解析完成后调用） */
    public void releaseSource() {
        source = null;
    }

    /**
     * 获取下一个 Token（流式接口）
     *
     * @return 下一个 Token，源码结束后持续返回 EOF
     */
    public Token nextToken() {
        if (!pending.isEmpty()) {
            return emit(pending.poll());
        }
        if (finished) {
            return new Token(TokenType.EOF, "", null, line, column, current);
        }

        if (atLineStart && bracketDepth == 0) {
            scanIndentation();
            if (!pending.isEmpty()) {
                return emit(pending.poll());
            }
        }

        skipWhitespace();

        if (isAtEnd()) {
            finish();
            return emit(pending.poll());
        }

        start = current;
        scanToken();

        // 括号内的换行不产生 token，继续扫描
        if (pending.isEmpty()) {
            return nextToken();
        }
        return emit(pending.poll());
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<Token>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.getType() != TokenType.EOF);
        return tokens;
    }

    private Token emit(Token token) {
        lastEmitted = token;
        return token;
    }

    // === 缩进处理 ===

    /**
     * 在逻辑行首计算缩进宽度，跳过空行和注释行，产生 INDENT/DEDENT。
     */
    private void scanIndentation() {
        int width;
        while (true) {
            width = 0;
            while (!isAtEnd() && (peek() == ' ' || peek() == '\t' || peek() == '\f')) {
                char c = advance();
                if (c == '\t') {
                    width += TAB_SIZE - (width % TAB_SIZE);
                } else if (c == ' ') {
                    width++;
                }
            }
            if (peek() == '#') {
                while (!isAtEnd() && peek() != '\n') advance();
            }
            if (peek() == '\r') {
                advance();
            }
            if (!isAtEnd() && peek() == '\n') {
                advance();
                newLine();
                continue;  // 空行
            }
            break;
        }
        atLineStart = false;
        if (isAtEnd()) {
            return;
        }

        start = current;
        int top = indentStack.peek();
        if (width > top) {
            indentStack.push(width);
            addToken(TokenType.INDENT, "");
        } else if (width < top) {
            while (width < indentStack.peek()) {
                indentStack.pop();
                addToken(TokenType.DEDENT, "");
            }
            if (width != indentStack.peek()) {
                error("Unindent does not match any outer indentation level");
            }
        }
    }

    /**
     * 源码结束：补齐 NEWLINE，关闭所有缩进层级，追加 EOF。
     */
    private void finish() {
        start = current;
        if (lastEmitted != null && !lastEmitted.isOneOf(TokenType.NEWLINE, TokenType.DEDENT)) {
            addToken(TokenType.NEWLINE, "");
        }
        while (indentStack.peek() > 0) {
            indentStack.pop();
            addToken(TokenType.DEDENT, "");
        }
        addToken(TokenType.EOF, "");
        finished = true;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t' || c == '\f') {
                advance();
            } else if (c == '#') {
                while (!isAtEnd() && peek() != '\n') advance();
            } else if (c == '\\' && peekNext() == '\n') {
                // 显式续行
                advance();
                advance();
                newLine();
            } else if (c == '\\' && peekNext() == '\r' && current + 2 < source.length()
                    && source.charAt(current + 2) == '\n') {
                advance();
                advance();
                advance();
                newLine();
            } else {
                break;
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 括号（跟踪嵌套深度）
            case '(': bracketDepth++; addToken(TokenType.LPAREN); break;
            case ')': closeBracket(); addToken(TokenType.RPAREN); break;
            case '[': bracketDepth++; addToken(TokenType.LBRACKET); break;
            case ']': closeBracket(); addToken(TokenType.RBRACKET); break;
            case '{': bracketDepth++; addToken(TokenType.LBRACE); break;
            case '}': closeBracket(); addToken(TokenType.RBRACE); break;

            // 单字符 Token
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '~': addToken(TokenType.TILDE); break;

            case '.':
                if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '+':
                addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
                break;

            case '-':
                if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                if (match('*')) {
                    addToken(match('=') ? TokenType.POW_ASSIGN : TokenType.POW);
                } else {
                    addToken(match('=') ? TokenType.MUL_ASSIGN : TokenType.MUL);
                }
                break;

            case '/':
                if (match('/')) {
                    addToken(match('=') ? TokenType.FLOOR_DIV_ASSIGN : TokenType.FLOOR_DIV);
                } else {
                    addToken(match('=') ? TokenType.DIV_ASSIGN : TokenType.DIV);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.MOD_ASSIGN : TokenType.MOD);
                break;

            case '@':
                addToken(match('=') ? TokenType.MATMUL_ASSIGN : TokenType.AT);
                break;

            case '&':
                addToken(match('=') ? TokenType.AMP_ASSIGN : TokenType.AMP);
                break;

            case '|':
                addToken(match('=') ? TokenType.PIPE_ASSIGN : TokenType.PIPE);
                break;

            case '^':
                addToken(match('=') ? TokenType.CARET_ASSIGN : TokenType.CARET);
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    error("Unexpected character '!'. Did you mean '!=' or 'not'?");
                }
                break;

            case '<':
                if (match('<')) {
                    addToken(match('=') ? TokenType.LSHIFT_ASSIGN : TokenType.LSHIFT);
                } else {
                    addToken(match('=') ? TokenType.LE : TokenType.LT);
                }
                break;

            case '>':
                if (match('>')) {
                    addToken(match('=') ? TokenType.RSHIFT_ASSIGN : TokenType.RSHIFT);
                } else {
                    addToken(match('=') ? TokenType.GE : TokenType.GT);
                }
                break;

            case '\n':
                if (bracketDepth == 0) {
                    addToken(TokenType.NEWLINE);
                    atLineStart = true;
                }
                newLine();
                break;

            // 字符串
            case '"':
            case '\'':
                if (peek() == c && peekNext() == c) {
                    advance();
                    advance();
                    tripleQuotedString(c);
                } else {
                    string(c);
                }
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private void closeBracket() {
        if (bracketDepth > 0) {
            bracketDepth--;
        }
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) ||
               (c >= 'a' && c <= 'f') ||
               (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        pending.add(new Token(type, lexeme, literal, line, tokenColumn(), start));
    }

    // 当前 token 起始列
    private int tokenColumn() {
        return column - (current - start);
    }

    // === 复杂 Token 扫描 ===

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') {
                error("Unterminated string");
                return;
            }
            if (peek() == '\\') {
                advance();
                escape(value);
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合引号
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private void tripleQuotedString(char quote) {
        int startLine = line;
        int startColumn = column - 3;
        StringBuilder value = new StringBuilder();
        boolean terminated = false;
        while (!isAtEnd()) {
            if (peek() == quote && peekNext() == quote
                    && current + 2 < source.length() && source.charAt(current + 2) == quote) {
                advance();
                advance();
                advance();
                terminated = true;
                break;
            }
            if (peek() == '\\') {
                advance();
                escape(value);
                continue;
            }
            char c = advance();
            value.append(c);
            if (c == '\n') newLine();
        }

        if (!terminated) {
            error("Unterminated triple-quoted string");
            return;
        }

        // 多行字符串的位置记在起始引号处
        String lexeme = source.substring(start, current);
        pending.add(new Token(TokenType.STRING_LITERAL, lexeme, value.toString(), startLine, startColumn, start));
    }

    private void escape(StringBuilder value) {
        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }
        char c = advance();
        switch (c) {
            case 'n': value.append('\n'); break;
            case 't': value.append('\t'); break;
            case 'r': value.append('\r'); break;
            case '0': value.append('\0'); break;
            case '\\': value.append('\\'); break;
            case '\'': value.append('\''); break;
            case '"': value.append('"'); break;
            case '\n': newLine(); break;  // 行尾反斜杠：续行
            case 'x': {
                StringBuilder hex = new StringBuilder();
                for (int i = 0; i < 2 && isHexDigit(peek()); i++) {
                    hex.append(advance());
                }
                if (hex.length() != 2) {
                    error("Invalid \\x escape");
                    return;
                }
                value.append((char) Integer.parseInt(hex.toString(), 16));
                break;
            }
            default:
                // 未知转义按 Python 规则原样保留
                value.append('\\').append(c);
                break;
        }
    }

    /** 移除数字中的下划线分隔符 */
    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    /** 消耗数字字符和下划线分隔符 */
    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    private void number() {
        char first = source.charAt(start);
        if (first == '0' && !isAtEnd()) {
            char next = Character.toLowerCase(peek());
            if (next == 'x') {
                radixNumber(16);
                return;
            } else if (next == 'o') {
                radixNumber(8);
                return;
            } else if (next == 'b') {
                radixNumber(2);
                return;
            }
        }

        boolean isFloat = first == '.';
        if (isFloat) {
            advanceDigits();
        } else {
            advanceDigits();
            // 小数部分："1.5"、"1."（后面紧跟标识符时视为属性访问）
            if (peek() == '.' && !isAlpha(peekNext())) {
                isFloat = true;
                advance();
                advanceDigits();
            }
        }

        // 指数部分
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || peekNext() == '+' || peekNext() == '-')) {
            isFloat = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (!isDigit(peek())) {
                error("Invalid float literal: " + source.substring(start, current));
                return;
            }
            advanceDigits();
        }

        String text = stripUnderscores(source.substring(start, current));
        try {
            if (isFloat) {
                addToken(TokenType.FLOAT_LITERAL, new BigDecimal(text));
            } else {
                addToken(TokenType.INT_LITERAL, new BigInteger(text));
            }
        } catch (NumberFormatException e) {
            error("Invalid number literal: " + source.substring(start, current));
        }
    }

    private void radixNumber(int radix) {
        advance(); // 消费 'x' / 'o' / 'b'
        while (Character.digit(peek(), radix) >= 0 || peek() == '_') advance();

        String text = stripUnderscores(source.substring(start + 2, current));
        if (text.isEmpty() || isAlphaNumeric(peek())) {
            error("Invalid integer literal: " + source.substring(start, current));
            return;
        }
        addToken(TokenType.INT_LITERAL, new BigInteger(text, radix));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void error(String message) {
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, line, tokenColumn(), message);
        errStream.println(errorMsg);
        addToken(TokenType.ERROR, message);
    }
}
