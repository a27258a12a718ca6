package com.viperk.compiler.ast.stmt;

import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.StmtVisitor;
import com.viperk.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.viperk.compiler.ast.expr.Expression;

/**
 * 增强赋值语句 {@code target op= value}
 */
public class AugAssignStmt extends Statement {
    private final Expression target;
    private final BinaryOp operator;
    private final Expression value;

    public AugAssignStmt(SourceLocation location, Expression target, BinaryOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAugAssignStmt(this, context);
    }
}
