package com.viperk.compiler.ast;

/**
 * 源码位置信息（行号、列号从 1 开始）
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int offset;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0);

    public SourceLocation(String file, int line, int column, int offset) {
        this.file = file != null ? file.intern() : null;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** 行内的 0 基列偏移，用于按列截取源码行 */
    public int getColumnOffset() {
        return column - 1;
    }

    public int getOffset() {
        return offset;
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
