package com.viperk.compiler.ast.stmt;

import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.StmtVisitor;
import com.viperk.compiler.ast.expr.Expression;

import java.util.List;

/**
 * If 语句
 *
 * <p>{@code elif} 解析为 else 分支中唯一的嵌套 IfStmt。</p>
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final List<Statement> body;
    private final List<Statement> orElse;  // 无 else 时为空列表

    public IfStmt(SourceLocation location, Expression condition,
                  List<Statement> body, List<Statement> orElse) {
        super(location);
        this.condition = condition;
        this.body = body;
        this.orElse = orElse;
    }

    public Expression getCondition() {
        return condition;
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
        return visitor.visitIfStmt(this, context);
    }
}
