package com.viperk.ir.translate;

import com.viperk.compiler.ast.expr.*;
import com.viperk.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.viperk.compiler.ast.expr.CompareExpr.CompareOp;
import com.viperk.ir.term.StmtTerm;
import com.viperk.ir.term.TypeTerm;
import com.viperk.ir.term.UnitTerm;

import java.util.ArrayList;
import java.util.List;

/**
 * 类型注解翻译
 *
 * <ul>
 *   <li>{@code num} → {@code %num}（任意标识符，不做检查）</li>
 *   <li>{@code T[5]} → {@code %listT(T, 5)}；{@code V[K]} → {@code %mapT(V, K)}</li>
 *   <li>{@code bytes <= 32} → {@code %bytesT(32)}</li>
 *   <li>{@code num(wei / sec)} → {@code %unitT(%num, %udiv(%wei, %sec), false)}</li>
 *   <li>{@code {a: num, b: bool}} → {@code %structT(%vdecl(a, %num) %vdecl(b, %bool))}</li>
 * </ul>
 */
public final class TypeTranslator {

    private static final String BYTES = "bytes";

    private final ConstTranslator constTranslator;

    public TypeTranslator(ConstTranslator constTranslator) {
        this.constTranslator = constTranslator;
    }

    /**
     * 翻译类型；null 表示省略的返回类型，对应 {@code %void}
     */
    public TypeTerm translate(Expression node) {
        if (node == null) {
            return TypeTerm.VOID;
        }
        if (node instanceof Name) {
            return new TypeTerm.Base(((Name) node).getId());
        }
        if (node instanceof SubscriptExpr) {
            return translateSubscript((SubscriptExpr) node);
        }
        if (node instanceof CompareExpr) {
            return translateByteArray((CompareExpr) node);
        }
        if (node instanceof DictLiteral) {
            return translateStruct((DictLiteral) node);
        }
        if (node instanceof CallExpr) {
            return translateUnitType((CallExpr) node);
        }
        throw UnsupportedConstructException.structural("Unsupported type annotation", node.getLocation());
    }

    /**
     * {@code %vdecl(x, TYPE)}；声明目标必须是简单名称
     */
    public StmtTerm.VarDecl translateVarDecl(Expression target, Expression annotation) {
        if (!(target instanceof Name)) {
            throw UnsupportedConstructException.detail(
                    "Declaration target must be a simple name", target.getLocation());
        }
        return new StmtTerm.VarDecl(((Name) target).getId(), translate(annotation));
    }

    private TypeTerm translateSubscript(SubscriptExpr node) {
        TypeTerm base = translate(node.getTarget());
        Expression index = node.getIndex();
        if (index instanceof Literal && ((Literal) index).isInteger()) {
            return new TypeTerm.ListOf(base, constTranslator.translate((Literal) index));
        }
        return new TypeTerm.MapOf(base, translate(index));
    }

    private TypeTerm translateByteArray(CompareExpr node) {
        if (!Name.is(node.getLeft(), BYTES) || node.isChained()
                || node.getOperators().get(0) != CompareOp.LE) {
            throw UnsupportedConstructException.detail(
                    "Only 'bytes <= N' is supported as a comparison-shaped type", node.getLocation());
        }
        Expression bound = node.getComparators().get(0);
        if (!(bound instanceof Literal) || !((Literal) bound).isInteger()) {
            throw UnsupportedConstructException.detail(
                    "Byte array bound must be an integer literal", bound.getLocation());
        }
        return new TypeTerm.ByteArray(((Literal) bound).intValue());
    }

    private TypeTerm translateStruct(DictLiteral node) {
        List<StmtTerm.VarDecl> fields = new ArrayList<StmtTerm.VarDecl>();
        for (DictLiteral.Entry entry : node.getEntries()) {
            fields.add(translateVarDecl(entry.getKey(), entry.getValue()));
        }
        return new TypeTerm.Struct(fields);
    }

    private TypeTerm translateUnitType(CallExpr node) {
        Expression callee = node.getCallee();
        if (!(callee instanceof Name) || !OperatorTables.isUnitBaseType(((Name) callee).getId())) {
            throw UnsupportedConstructException.detail(
                    "Unit types must be based on num or decimal", node.getLocation());
        }
        if (node.hasNamedArgs()) {
            throw UnsupportedConstructException.detail(
                    "Named arguments are not supported in unit types", node.getLocation());
        }
        List<Expression> args = node.getPositionalValues();
        boolean positional = !args.isEmpty() && Name.is(args.get(args.size() - 1), OperatorTables.POSITIONAL);
        int expected = positional ? 2 : 1;
        if (args.size() != expected) {
            throw UnsupportedConstructException.detail(
                    "Unit type expects a unit and an optional 'positional' marker", node.getLocation());
        }
        return new TypeTerm.WithUnit(((Name) callee).getId(), translateUnit(args.get(0)), positional);
    }

    /**
     * 单位表达式：名称为基本单位；{@code *}、{@code /} 组合；{@code **} 的指数须为整数字面量
     */
    public UnitTerm translateUnit(Expression node) {
        if (node instanceof Name) {
            return new UnitTerm.Base(((Name) node).getId());
        }
        if (node instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) node;
            switch (bin.getOperator()) {
                case MUL:
                    return new UnitTerm.Binary(false, translateUnit(bin.getLeft()), translateUnit(bin.getRight()));
                case DIV:
                    return new UnitTerm.Binary(true, translateUnit(bin.getLeft()), translateUnit(bin.getRight()));
                case POW:
                    Expression exponent = bin.getRight();
                    if (!(exponent instanceof Literal) || !((Literal) exponent).isInteger()) {
                        throw UnsupportedConstructException.detail(
                                "Unit exponent must be an integer literal", exponent.getLocation());
                    }
                    return new UnitTerm.Pow(translateUnit(bin.getLeft()), ((Literal) exponent).intValue());
                default:
                    throw UnsupportedConstructException.detail(
                            "Unsupported unit operator '" + bin.getOperator().toSourceString() + "'",
                            node.getLocation());
            }
        }
        throw UnsupportedConstructException.detail("Unsupported unit expression", node.getLocation());
    }
}
