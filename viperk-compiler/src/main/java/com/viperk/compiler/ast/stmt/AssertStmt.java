package com.viperk.compiler.ast.stmt;

import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.StmtVisitor;
import com.viperk.compiler.ast.expr.Expression;

/**
 * Assert 语句 {@code assert test[, message]}
 */
public class AssertStmt extends Statement {
    private final Expression test;
    private final Expression message;  // 可选

    public AssertStmt(SourceLocation location, Expression test, Expression message) {
        super(location);
        this.test = test;
        this.message = message;
    }

    public Expression getTest() {
        return test;
    }

    public Expression getMessage() {
        return message;
    }

    public boolean hasMessage() {
        return message != null;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAssertStmt(this, context);
    }
}
