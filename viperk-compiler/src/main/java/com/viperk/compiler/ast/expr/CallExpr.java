package com.viperk.compiler.ast.expr;

import com.viperk.compiler.ast.AstNode;
import com.viperk.compiler.ast.ExprVisitor;
import com.viperk.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 调用表达式
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Argument> args;

    public CallExpr(SourceLocation location, Expression callee, List<Argument> args) {
        super(location);
        this.callee = callee;
        this.args = args;
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Argument> getArgs() {
        return args;
    }

    /** 位置参数的值（按出现顺序） */
    public List<Expression> getPositionalValues() {
        List<Expression> values = new ArrayList<Expression>();
        for (Argument arg : args) {
            if (!arg.isNamed()) {
                values.add(arg.getValue());
            }
        }
        return values;
    }

    public boolean hasNamedArgs() {
        for (Argument arg : args) {
            if (arg.isNamed()) return true;
        }
        return false;
    }

    /** 被调用者是否为给定名称的裸标识符 */
    public boolean isCallTo(String name) {
        return Name.is(callee, name);
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }

    /**
     * 调用参数
     */
    public static final class Argument extends AstNode {
        private final String name;           // 命名参数（keyword）
        private final Expression value;

        public Argument(SourceLocation location, String name, Expression value) {
            super(location);
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public boolean isNamed() {
            return name != null;
        }

        public Expression getValue() {
            return value;
        }
    }
}
