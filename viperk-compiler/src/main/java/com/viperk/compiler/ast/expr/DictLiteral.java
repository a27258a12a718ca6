package com.viperk.compiler.ast.expr;

import com.viperk.compiler.ast.AstNode;
import com.viperk.compiler.ast.ExprVisitor;
import com.viperk.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 字典字面量 {k: v, ...}
 *
 * <p>在类型注解中表示结构体字段表，在事件声明中表示事件参数表。</p>
 */
public class DictLiteral extends Expression {
    private final List<Entry> entries;

    public DictLiteral(SourceLocation location, List<Entry> entries) {
        super(location);
        this.entries = entries;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitDictLiteral(this, context);
    }

    /**
     * 字典条目
     */
    public static final class Entry extends AstNode {
        private final Expression key;
        private final Expression value;

        public Entry(SourceLocation location, Expression key, Expression value) {
            super(location);
            this.key = key;
            this.value = value;
        }

        public Expression getKey() {
            return key;
        }

        public Expression getValue() {
            return value;
        }
    }
}
