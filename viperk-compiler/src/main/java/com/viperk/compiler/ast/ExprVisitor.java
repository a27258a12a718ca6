package com.viperk.compiler.ast;

import com.viperk.compiler.ast.expr.*;

/**
 * 表达式访问者接口
 *
 * <p>不提供默认实现：新增表达式节点种类时，所有实现类都必须显式处理，
 * 否则编译失败。</p>
 */
public interface ExprVisitor<R, C> {

    R visitName(Name node, C ctx);

    R visitLiteral(Literal node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitBoolOpExpr(BoolOpExpr node, C ctx);

    R visitCompareExpr(CompareExpr node, C ctx);

    R visitAttributeExpr(AttributeExpr node, C ctx);

    R visitSubscriptExpr(SubscriptExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitCollectionLiteral(CollectionLiteral node, C ctx);

    R visitDictLiteral(DictLiteral node, C ctx);

    R visitSliceExpr(SliceExpr node, C ctx);

    R visitConditionalExpr(ConditionalExpr node, C ctx);

    R visitLambdaExpr(LambdaExpr node, C ctx);
}
