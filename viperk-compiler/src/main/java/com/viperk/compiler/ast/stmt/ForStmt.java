package com.viperk.compiler.ast.stmt;

import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.StmtVisitor;
import com.viperk.compiler.ast.expr.Expression;

import java.util.List;

/**
 * For 语句 {@code for target in iterable: body [else: orElse]}
 */
public class ForStmt extends Statement {
    private final Expression target;
    private final Expression iterable;
    private final List<Statement> body;
    private final List<Statement> orElse;

    public ForStmt(SourceLocation location, Expression target, Expression iterable,
                   List<Statement> body, List<Statement> orElse) {
        super(location);
        this.target = target;
        this.iterable = iterable;
        this.body = body;
        this.orElse = orElse;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIterable() {
        return iterable;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    public boolean hasElse() {
        return !orElse.isEmpty();
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
