package com.viperk.compiler.lexer;

/**
 * Viper 源码中的一个词法单元。
 *
 * <p>{@code value} 是字面量的解析结果：整数为 {@link java.math.BigInteger}，小数为
 * {@link java.math.BigDecimal}，字符串为转义后的文本，ERROR token 为错误描述，其余为 null。
 * 位置取 token 首字符：行、列从 1 开始，{@code offset} 是源码中的 0 基字符下标，
 * 十六进制常量按它回查原文。缩进类 token 的 lexeme 为空串。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object value;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object value, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.value = value;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    /** 源码原文 */
    public String getLexeme() {
        return lexeme;
    }

    public Object getValue() {
        return value;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public boolean isOneOf(TokenType first, TokenType... rest) {
        if (type == first) return true;
        for (TokenType candidate : rest) {
            if (type == candidate) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(line).append(':').append(column).append(' ').append(type);
        if (!lexeme.isEmpty()) {
            sb.append(" '").append(lexeme).append('\'');
        }
        if (value != null && !lexeme.equals(value)) {
            sb.append(" = ").append(value);
        }
        return sb.toString();
    }
}
