package com.viperk.compiler.ast.stmt;

import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.StmtVisitor;
import com.viperk.compiler.ast.expr.Expression;

/**
 * Raise 语句
 */
public class RaiseStmt extends Statement {
    private final Expression exception;  // 可选

    public RaiseStmt(SourceLocation location, Expression exception) {
        super(location);
        this.exception = exception;
    }

    public Expression getException() {
        return exception;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitRaiseStmt(this, context);
    }
}
