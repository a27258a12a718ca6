package com.viperk.compiler.ast.decl;

import com.viperk.compiler.ast.AstNode;
import com.viperk.compiler.ast.AstVisitor;
import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 程序（编译单元）：顶层语句序列
 */
public class Program extends AstNode {
    private final List<Statement> body;

    public Program(SourceLocation location, List<Statement> body) {
        super(location);
        this.body = body;
    }

    public List<Statement> getBody() {
        return body;
    }

    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
