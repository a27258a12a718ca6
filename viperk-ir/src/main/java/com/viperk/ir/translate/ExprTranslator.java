package com.viperk.ir.translate;

import com.viperk.compiler.ast.ExprVisitor;
import com.viperk.compiler.ast.expr.*;
import com.viperk.compiler.ast.expr.CollectionLiteral.CollectionKind;
import com.viperk.ir.term.ExprTerm;

import java.util.ArrayList;
import java.util.List;

/**
 * 表达式翻译
 *
 * <p>按节点种类分派；运算优先级已由解析器确定，这里只做逐节点映射。
 * 名称、属性与下标共用变量引用链规则（{@link #translateVar}）。</p>
 */
public final class ExprTranslator implements ExprVisitor<ExprTerm, Void> {

    private static final String SELF = "self";

    private final ConstTranslator constTranslator;

    public ExprTranslator(ConstTranslator constTranslator) {
        this.constTranslator = constTranslator;
    }

    public ExprTerm translate(Expression expr) {
        return expr.accept(this, null);
    }

    /**
     * 以空格分隔渲染的参数列表（{@code %icall}、{@code %log}、{@code %list}）
     */
    public List<ExprTerm> translateAll(List<Expression> exprs) {
        List<ExprTerm> result = new ArrayList<ExprTerm>(exprs.size());
        for (Expression expr : exprs) {
            result.add(translate(expr));
        }
        return result;
    }

    /**
     * 调用参数：不允许命名参数
     */
    public List<ExprTerm> translateArgs(CallExpr call) {
        if (call.hasNamedArgs()) {
            throw UnsupportedConstructException.detail("Named call arguments are not supported", call.getLocation());
        }
        return translateAll(call.getPositionalValues());
    }

    /**
     * 变量引用链：{@code x} → {@code %var(x)}，{@code self.x} → {@code %svar(x)}，
     * {@code a.f} → {@code %attribute(A, f)}，{@code a[e]} → {@code %subscript(A, E)}
     */
    public ExprTerm translateVar(Expression expr) {
        if (expr instanceof Name) {
            return new ExprTerm.Var(((Name) expr).getId());
        }
        if (expr instanceof AttributeExpr) {
            AttributeExpr attr = (AttributeExpr) expr;
            if (Name.is(attr.getTarget(), SELF)) {
                return new ExprTerm.StorageVar(attr.getAttr());
            }
            return new ExprTerm.Attribute(translateVar(attr.getTarget()), attr.getAttr());
        }
        if (expr instanceof SubscriptExpr) {
            SubscriptExpr sub = (SubscriptExpr) expr;
            return new ExprTerm.Subscript(translateVar(sub.getTarget()), translate(sub.getIndex()));
        }
        throw UnsupportedConstructException.structural("Unsupported variable reference", expr.getLocation());
    }

    public static boolean isVarShape(Expression expr) {
        return expr instanceof Name || expr instanceof AttributeExpr || expr instanceof SubscriptExpr;
    }

    // ==================== 字面量与名称 ====================

    @Override
    public ExprTerm visitLiteral(Literal node, Void ctx) {
        return constTranslator.translate(node);
    }

    @Override
    public ExprTerm visitName(Name node, Void ctx) {
        String id = node.getId();
        if ("true".equals(id) || "false".equals(id)) {
            return new ExprTerm.BoolConst("true".equals(id));
        }
        if (SELF.equals(id)) {
            return ExprTerm.SELF;
        }
        return translateVar(node);
    }

    // ==================== 运算 ====================

    @Override
    public ExprTerm visitBinaryExpr(BinaryExpr node, Void ctx) {
        String symbol = OperatorTables.binarySymbol(node.getOperator());
        if (symbol == null) {
            throw UnsupportedConstructException.detail(
                    "Unsupported binary operator '" + node.getOperator().toSourceString() + "'", node.getLocation());
        }
        return ExprTerm.Operation.binOp(symbol, translate(node.getLeft()), translate(node.getRight()));
    }

    @Override
    public ExprTerm visitCompareExpr(CompareExpr node, Void ctx) {
        if (node.isChained()) {
            throw UnsupportedConstructException.detail("Chained comparisons are not supported", node.getLocation());
        }
        CompareExpr.CompareOp op = node.getOperators().get(0);
        String symbol = OperatorTables.compareSymbol(op);
        if (symbol == null) {
            throw UnsupportedConstructException.detail(
                    "Unsupported comparison operator '" + op.toSourceString() + "'", node.getLocation());
        }
        return ExprTerm.Operation.compareOp(symbol, translate(node.getLeft()),
                translate(node.getComparators().get(0)));
    }

    @Override
    public ExprTerm visitBoolOpExpr(BoolOpExpr node, Void ctx) {
        if (node.getValues().size() != 2) {
            throw UnsupportedConstructException.detail(
                    "Boolean operators must have exactly two operands", node.getLocation());
        }
        String symbol = OperatorTables.boolSymbol(node.getOperator());
        return ExprTerm.Operation.boolOp(symbol, translate(node.getValues().get(0)),
                translate(node.getValues().get(1)));
    }

    @Override
    public ExprTerm visitUnaryExpr(UnaryExpr node, Void ctx) {
        String symbol = OperatorTables.unarySymbol(node.getOperator());
        if (symbol == null) {
            throw UnsupportedConstructException.detail(
                    "Unsupported unary operator '" + node.getOperator().toSourceString() + "'", node.getLocation());
        }
        return new ExprTerm.UnaryOperation(symbol, translate(node.getOperand()));
    }

    // ==================== 引用 ====================

    @Override
    public ExprTerm visitAttributeExpr(AttributeExpr node, Void ctx) {
        if (node.getTarget() instanceof Name) {
            String object = ((Name) node.getTarget()).getId();
            if (OperatorTables.isReservedProperty(object, node.getAttr())) {
                return new ExprTerm.ReservedProperty(object, node.getAttr());
            }
        }
        return translateVar(node);
    }

    @Override
    public ExprTerm visitSubscriptExpr(SubscriptExpr node, Void ctx) {
        return translateVar(node);
    }

    @Override
    public ExprTerm visitCollectionLiteral(CollectionLiteral node, Void ctx) {
        if (node.getKind() != CollectionKind.LIST) {
            throw UnsupportedConstructException.structural("Tuples are not supported", node.getLocation());
        }
        return new ExprTerm.ListLiteral(translateAll(node.getElements()));
    }

    @Override
    public ExprTerm visitDictLiteral(DictLiteral node, Void ctx) {
        throw UnsupportedConstructException.structural(
                "Dict literals are only allowed as struct types", node.getLocation());
    }

    @Override
    public ExprTerm visitSliceExpr(SliceExpr node, Void ctx) {
        throw UnsupportedConstructException.structural("Slices are not supported", node.getLocation());
    }

    @Override
    public ExprTerm visitConditionalExpr(ConditionalExpr node, Void ctx) {
        throw UnsupportedConstructException.structural(
                "Conditional expressions are not supported", node.getLocation());
    }

    @Override
    public ExprTerm visitLambdaExpr(LambdaExpr node, Void ctx) {
        throw UnsupportedConstructException.structural("Lambda expressions are not supported", node.getLocation());
    }

    // ==================== 调用 ====================

    @Override
    public ExprTerm visitCallExpr(CallExpr node, Void ctx) {
        Expression callee = node.getCallee();
        if (callee instanceof Name) {
            String name = ((Name) callee).getId();
            if (OperatorTables.WEI_VALUE.equals(name)) {
                return translateWeiValue(node);
            }
            return new ExprTerm.Call(name, translateArgs(node));
        }
        if (callee instanceof AttributeExpr && Name.is(((AttributeExpr) callee).getTarget(), SELF)) {
            return new ExprTerm.InternalCall(((AttributeExpr) callee).getAttr(), translateArgs(node));
        }
        throw UnsupportedConstructException.structural(
                "Only calls to a bare name or self.<method> are supported", node.getLocation());
    }

    // as_wei_value(e, unit)：unit 可写作裸名称或字符串
    private ExprTerm translateWeiValue(CallExpr node) {
        if (node.hasNamedArgs()) {
            throw UnsupportedConstructException.detail("Named call arguments are not supported", node.getLocation());
        }
        List<Expression> args = node.getPositionalValues();
        if (args.size() != 2) {
            throw UnsupportedConstructException.detail(
                    OperatorTables.WEI_VALUE + " expects an amount and a unit", node.getLocation());
        }
        Expression unit = args.get(1);
        String unitName;
        if (unit instanceof Name) {
            unitName = ((Name) unit).getId();
        } else if (unit instanceof Literal && ((Literal) unit).getKind() == Literal.LiteralKind.STRING) {
            unitName = ((Literal) unit).stringValue();
        } else {
            throw UnsupportedConstructException.detail(
                    "Unit of " + OperatorTables.WEI_VALUE + " must be a name or a string", unit.getLocation());
        }
        return new ExprTerm.WeiValue(translate(args.get(0)), unitName);
    }
}
