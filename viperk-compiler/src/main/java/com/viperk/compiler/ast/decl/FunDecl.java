package com.viperk.compiler.ast.decl;

import com.viperk.compiler.ast.SourceLocation;
import com.viperk.compiler.ast.StmtVisitor;
import com.viperk.compiler.ast.expr.Expression;
import com.viperk.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 函数声明 {@code @decorator def name(params) -> returns: body}
 *
 * <p>与 Python 一致，函数声明本身也是语句，可出现在任意语句位置；
 * 是否允许由下游决定。</p>
 */
public class FunDecl extends Statement {
    private final List<Decorator> decorators;
    private final String name;
    private final List<Parameter> params;
    private final Expression returns;  // 可选：返回类型注解
    private final List<Statement> body;

    public FunDecl(SourceLocation location, List<Decorator> decorators, String name,
                   List<Parameter> params, Expression returns, List<Statement> body) {
        super(location);
        this.decorators = decorators;
        this.name = name;
        this.params = params;
        this.returns = returns;
        this.body = body;
    }

    public List<Decorator> getDecorators() {
        return decorators;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public Expression getReturns() {
        return returns;
    }

    public boolean hasReturns() {
        return returns != null;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitFunDecl(this, context);
    }
}
