package com.viperk.compiler.lexer;

/**
 * Viper 词法单元类型（Python 语法子集）
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,            // 42, 0xff, 0o17, 0b101
    FLOAT_LITERAL,          // 2.5, 1e3
    STRING_LITERAL,         // "..." '...' """..."""

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 声明 ===
    KW_DEF, KW_LAMBDA,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELIF, KW_ELSE, KW_FOR, KW_WHILE,
    KW_BREAK, KW_CONTINUE, KW_PASS, KW_RETURN,
    KW_ASSERT, KW_RAISE,

    // === 关键词 - 运算 ===
    KW_AND, KW_OR, KW_NOT, KW_IN, KW_IS,

    // === 关键词 - 常量 ===
    KW_TRUE, KW_FALSE, KW_NONE,

    // === 操作符 - 算术/位运算 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    FLOOR_DIV,      // //
    MOD,            // %
    POW,            // **
    AT,             // @ （装饰器 / 矩阵乘）
    AMP,            // &
    PIPE,           // |
    CARET,          // ^
    TILDE,          // ~
    LSHIFT,         // <<
    RSHIFT,         // >>

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 赋值 ===
    ASSIGN,                 // =
    PLUS_ASSIGN,            // +=
    MINUS_ASSIGN,           // -=
    MUL_ASSIGN,             // *=
    DIV_ASSIGN,             // /=
    FLOOR_DIV_ASSIGN,       // //=
    MOD_ASSIGN,             // %=
    POW_ASSIGN,             // **=
    MATMUL_ASSIGN,          // @=
    AMP_ASSIGN,             // &=
    PIPE_ASSIGN,            // |=
    CARET_ASSIGN,           // ^=
    LSHIFT_ASSIGN,          // <<=
    RSHIFT_ASSIGN,          // >>=

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    DOT,            // .
    COLON,          // :
    SEMICOLON,      // ;
    ARROW,          // ->

    // === 缩进结构 ===
    NEWLINE,
    INDENT,
    DEDENT,

    // === 特殊 ===
    EOF,
    ERROR;

    /**
     * 是否为增强赋值操作符（不含 =）
     */
    public boolean isAugmentedAssignOp() {
        switch (this) {
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
            case MUL_ASSIGN:
            case DIV_ASSIGN:
            case FLOOR_DIV_ASSIGN:
            case MOD_ASSIGN:
            case POW_ASSIGN:
            case MATMUL_ASSIGN:
            case AMP_ASSIGN:
            case PIPE_ASSIGN:
            case CARET_ASSIGN:
            case LSHIFT_ASSIGN:
            case RSHIFT_ASSIGN:
                return true;
            default:
                return false;
        }
    }
}
