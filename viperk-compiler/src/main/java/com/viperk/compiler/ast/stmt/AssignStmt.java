package com.viperk.compiler.ast.stmt;

import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.StmtVisitor;
import com.viperk.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 赋值语句 {@code t1 = t2 = value}
 */
public class AssignStmt extends Statement {
    private final List<Expression> targets;
    private final Expression value;

    public AssignStmt(SourceLocation location, List<Expression> targets, Expression value) {
        super(location);
        this.targets = targets;
        this.value = value;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
