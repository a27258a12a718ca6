package com.viperk.compiler.ast;

/**
 * 语法树节点基类
 *
 * <p>节点一经构造即不可变；变换 pass 以 copy-on-change 方式产生新树。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
