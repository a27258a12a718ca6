package com.viperk.compiler.ast.stmt;

import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.StmtVisitor;
import com.viperk.compiler.ast.expr.Expression;

/**
 * 带类型注解的声明 {@code target: annotation [= value]}
 */
public class AnnAssignStmt extends Statement {
    private final Expression target;
    private final Expression annotation;
    private final Expression value;  // 可选

    public AnnAssignStmt(SourceLocation location, Expression target, Expression annotation, Expression value) {
        super(location);
        this.target = target;
        this.annotation = annotation;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAnnAssignStmt(this, context);
    }
}
