package com.viperk.ir.translate;

import com.viperk.compiler.ast.SourceLocation;

/**
 * 无法翻译的语法构造。翻译立即终止，不产生任何部分输出。
 */
public class UnsupportedConstructException extends RuntimeException {

    /**
     * 失败类别
     */
    public enum Kind {
        /** 节点形状本身没有对应的 IR */
        STRUCTURAL,
        /** 形状可识别，但某个细节超出支持范围（如链式比较、命名参数） */
        DETAIL
    }

    private final Kind kind;
    private final SourceLocation location;

    public UnsupportedConstructException(Kind kind, String message, SourceLocation location) {
        super(message);
        this.kind = kind;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public static UnsupportedConstructException structural(String message, SourceLocation location) {
        return new UnsupportedConstructException(Kind.STRUCTURAL, message, location);
    }

    public static UnsupportedConstructException detail(String message, SourceLocation location) {
        return new UnsupportedConstructException(Kind.DETAIL, message, location);
    }

    public Kind getKind() {
        return kind;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        if (!location.isKnown()) {
            return super.getMessage();
        }
        return super.getMessage() + " at line " + location.getLine() + ", column " + location.getColumn();
    }
}
