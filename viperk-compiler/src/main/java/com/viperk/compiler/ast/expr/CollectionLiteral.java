package com.viperk.compiler.ast.expr;

import com.viperk.compiler.ast.ExprVisitor;
import com.viperk.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 列表/元组字面量（如 [1, 2, 3]、(a, b)）
 */
public class CollectionLiteral extends Expression {
    private final CollectionKind kind;
    private final List<Expression> elements;

    public CollectionLiteral(SourceLocation location, CollectionKind kind, List<Expression> elements) {
        super(location);
        this.kind = kind;
        this.elements = elements;
    }

    public CollectionKind getKind() {
        return kind;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitCollectionLiteral(this, context);
    }

    /**
     * 集合类型
     */
    public enum CollectionKind {
        LIST,
        TUPLE
    }
}
