package com.viperk.compiler.ast.stmt;

import com.viperk.compiler.ast.AstNode;
import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.StmtVisitor;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(StmtVisitor<R, C> visitor, C context);
}
