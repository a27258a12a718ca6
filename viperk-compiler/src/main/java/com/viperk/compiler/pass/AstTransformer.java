package com.viperk.compiler.pass;

import com.viperk.compiler.ast.AstNode;
import com.viperk.compiler.ast.AstVisitor;
import com.viperk.compiler.ast.decl.Decorator;
import com.viperk.compiler.ast.decl.FunDecl;
import com.viperk.compiler.ast.decl.Parameter;
import com.viperk.compiler.ast.decl.Program;
import com.viperk.compiler.ast.expr.*;
import com.viperk.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 语法树恒等变换基类（copy-on-change）。
 * 递归遍历所有节点，子节点无变化时返回原节点，否则构造新节点。
 * 子类可覆盖特定 visit 方法实现预处理 pass。
 */
public class AstTransformer implements AstVisitor<AstNode, Void> {

    public Program transform(Program program) {
        if (program == null) return null;
        return (Program) program.accept(this, null);
    }

    // ==================== 辅助方法 ====================

    protected Expression transformExpr(Expression expr) {
        if (expr == null) return null;
        return (Expression) expr.accept(this, null);
    }

    protected Statement transformStmt(Statement stmt) {
        if (stmt == null) return null;
        return (Statement) stmt.accept(this, null);
    }

    protected List<Expression> transformExprs(List<Expression> exprs) {
        List<Expression> result = null;
        for (int i = 0; i < exprs.size(); i++) {
            Expression original = exprs.get(i);
            Expression transformed = transformExpr(original);
            if (transformed != original && result == null) {
                result = new ArrayList<Expression>(exprs.subList(0, i));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : exprs;
    }

    protected List<Statement> transformStmts(List<Statement> stmts) {
        List<Statement> result = null;
        for (int i = 0; i < stmts.size(); i++) {
            Statement original = stmts.get(i);
            Statement transformed = transformStmt(original);
            if (transformed != original && result == null) {
                result = new ArrayList<Statement>(stmts.subList(0, i));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : stmts;
    }

    // ==================== 程序 ====================

    @Override
    public AstNode visitProgram(Program node, Void ctx) {
        List<Statement> body = transformStmts(node.getBody());
        if (body == node.getBody()) return node;
        return new Program(node.getLocation(), body);
    }

    // ==================== 表达式 ====================

    @Override
    public AstNode visitName(Name node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitLiteral(Literal node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitBinaryExpr(BinaryExpr node, Void ctx) {
        Expression left = transformExpr(node.getLeft());
        Expression right = transformExpr(node.getRight());
        if (left == node.getLeft() && right == node.getRight()) return node;
        return new BinaryExpr(node.getLocation(), left, node.getOperator(), right);
    }

    @Override
    public AstNode visitUnaryExpr(UnaryExpr node, Void ctx) {
        Expression operand = transformExpr(node.getOperand());
        if (operand == node.getOperand()) return node;
        return new UnaryExpr(node.getLocation(), node.getOperator(), operand);
    }

    @Override
    public AstNode visitBoolOpExpr(BoolOpExpr node, Void ctx) {
        List<Expression> values = transformExprs(node.getValues());
        if (values == node.getValues()) return node;
        return new BoolOpExpr(node.getLocation(), node.getOperator(), values);
    }

    @Override
    public AstNode visitCompareExpr(CompareExpr node, Void ctx) {
        Expression left = transformExpr(node.getLeft());
        List<Expression> comparators = transformExprs(node.getComparators());
        if (left == node.getLeft() && comparators == node.getComparators()) return node;
        return new CompareExpr(node.getLocation(), left, node.getOperators(), comparators);
    }

    @Override
    public AstNode visitAttributeExpr(AttributeExpr node, Void ctx) {
        Expression target = transformExpr(node.getTarget());
        if (target == node.getTarget()) return node;
        return new AttributeExpr(node.getLocation(), target, node.getAttr());
    }

    @Override
    public AstNode visitSubscriptExpr(SubscriptExpr node, Void ctx) {
        Expression target = transformExpr(node.getTarget());
        Expression index = transformExpr(node.getIndex());
        if (target == node.getTarget() && index == node.getIndex()) return node;
        return new SubscriptExpr(node.getLocation(), target, index);
    }

    @Override
    public AstNode visitCallExpr(CallExpr node, Void ctx) {
        Expression callee = transformExpr(node.getCallee());
        boolean changed = callee != node.getCallee();
        List<CallExpr.Argument> args = new ArrayList<CallExpr.Argument>(node.getArgs().size());
        for (CallExpr.Argument arg : node.getArgs()) {
            Expression value = transformExpr(arg.getValue());
            if (value != arg.getValue()) {
                changed = true;
                args.add(new CallExpr.Argument(arg.getLocation(), arg.getName(), value));
            } else {
                args.add(arg);
            }
        }
        if (!changed) return node;
        return new CallExpr(node.getLocation(), callee, args);
    }

    @Override
    public AstNode visitCollectionLiteral(CollectionLiteral node, Void ctx) {
        List<Expression> elements = transformExprs(node.getElements());
        if (elements == node.getElements()) return node;
        return new CollectionLiteral(node.getLocation(), node.getKind(), elements);
    }

    @Override
    public AstNode visitDictLiteral(DictLiteral node, Void ctx) {
        boolean changed = false;
        List<DictLiteral.Entry> entries = new ArrayList<DictLiteral.Entry>(node.getEntries().size());
        for (DictLiteral.Entry entry : node.getEntries()) {
            Expression key = transformExpr(entry.getKey());
            Expression value = transformExpr(entry.getValue());
            if (key != entry.getKey() || value != entry.getValue()) {
                changed = true;
                entries.add(new DictLiteral.Entry(entry.getLocation(), key, value));
            } else {
                entries.add(entry);
            }
        }
        if (!changed) return node;
        return new DictLiteral(node.getLocation(), entries);
    }

    @Override
    public AstNode visitSliceExpr(SliceExpr node, Void ctx) {
        Expression lower = transformExpr(node.getLower());
        Expression upper = transformExpr(node.getUpper());
        Expression step = transformExpr(node.getStep());
        if (lower == node.getLower() && upper == node.getUpper() && step == node.getStep()) return node;
        return new SliceExpr(node.getLocation(), lower, upper, step);
    }

    @Override
    public AstNode visitConditionalExpr(ConditionalExpr node, Void ctx) {
        Expression body = transformExpr(node.getBody());
        Expression condition = transformExpr(node.getCondition());
        Expression orElse = transformExpr(node.getOrElse());
        if (body == node.getBody() && condition == node.getCondition()
                && orElse == node.getOrElse()) return node;
        return new ConditionalExpr(node.getLocation(), body, condition, orElse);
    }

    @Override
    public AstNode visitLambdaExpr(LambdaExpr node, Void ctx) {
        Expression body = transformExpr(node.getBody());
        if (body == node.getBody()) return node;
        return new LambdaExpr(node.getLocation(), node.getParams(), body);
    }

    // ==================== 语句 ====================

    @Override
    public AstNode visitFunDecl(FunDecl node, Void ctx) {
        boolean changed = false;

        List<Decorator> decorators = new ArrayList<Decorator>(node.getDecorators().size());
        for (Decorator deco : node.getDecorators()) {
            Expression expr = transformExpr(deco.getExpression());
            if (expr != deco.getExpression()) {
                changed = true;
                decorators.add(new Decorator(deco.getLocation(), expr));
            } else {
                decorators.add(deco);
            }
        }

        List<Parameter> params = new ArrayList<Parameter>(node.getParams().size());
        for (Parameter param : node.getParams()) {
            Expression annotation = transformExpr(param.getAnnotation());
            Expression defaultValue = transformExpr(param.getDefaultValue());
            if (annotation != param.getAnnotation() || defaultValue != param.getDefaultValue()) {
                changed = true;
                params.add(new Parameter(param.getLocation(), param.getName(), annotation, defaultValue));
            } else {
                params.add(param);
            }
        }

        Expression returns = transformExpr(node.getReturns());
        List<Statement> body = transformStmts(node.getBody());
        if (!changed && returns == node.getReturns() && body == node.getBody()) return node;
        return new FunDecl(node.getLocation(), decorators, node.getName(), params, returns, body);
    }

    @Override
    public AstNode visitAnnAssignStmt(AnnAssignStmt node, Void ctx) {
        Expression target = transformExpr(node.getTarget());
        Expression annotation = transformExpr(node.getAnnotation());
        Expression value = transformExpr(node.getValue());
        if (target == node.getTarget() && annotation == node.getAnnotation()
                && value == node.getValue()) return node;
        return new AnnAssignStmt(node.getLocation(), target, annotation, value);
    }

    @Override
    public AstNode visitAssignStmt(AssignStmt node, Void ctx) {
        List<Expression> targets = transformExprs(node.getTargets());
        Expression value = transformExpr(node.getValue());
        if (targets == node.getTargets() && value == node.getValue()) return node;
        return new AssignStmt(node.getLocation(), targets, value);
    }

    @Override
    public AstNode visitAugAssignStmt(AugAssignStmt node, Void ctx) {
        Expression target = transformExpr(node.getTarget());
        Expression value = transformExpr(node.getValue());
        if (target == node.getTarget() && value == node.getValue()) return node;
        return new AugAssignStmt(node.getLocation(), target, node.getOperator(), value);
    }

    @Override
    public AstNode visitIfStmt(IfStmt node, Void ctx) {
        Expression condition = transformExpr(node.getCondition());
        List<Statement> body = transformStmts(node.getBody());
        List<Statement> orElse = transformStmts(node.getOrElse());
        if (condition == node.getCondition() && body == node.getBody()
                && orElse == node.getOrElse()) return node;
        return new IfStmt(node.getLocation(), condition, body, orElse);
    }

    @Override
    public AstNode visitForStmt(ForStmt node, Void ctx) {
        Expression target = transformExpr(node.getTarget());
        Expression iterable = transformExpr(node.getIterable());
        List<Statement> body = transformStmts(node.getBody());
        List<Statement> orElse = transformStmts(node.getOrElse());
        if (target == node.getTarget() && iterable == node.getIterable()
                && body == node.getBody() && orElse == node.getOrElse()) return node;
        return new ForStmt(node.getLocation(), target, iterable, body, orElse);
    }

    @Override
    public AstNode visitWhileStmt(WhileStmt node, Void ctx) {
        Expression condition = transformExpr(node.getCondition());
        List<Statement> body = transformStmts(node.getBody());
        List<Statement> orElse = transformStmts(node.getOrElse());
        if (condition == node.getCondition() && body == node.getBody()
                && orElse == node.getOrElse()) return node;
        return new WhileStmt(node.getLocation(), condition, body, orElse);
    }

    @Override
    public AstNode visitBreakStmt(BreakStmt node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitContinueStmt(ContinueStmt node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitPassStmt(PassStmt node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitReturnStmt(ReturnStmt node, Void ctx) {
        Expression value = transformExpr(node.getValue());
        if (value == node.getValue()) return node;
        return new ReturnStmt(node.getLocation(), value);
    }

    @Override
    public AstNode visitAssertStmt(AssertStmt node, Void ctx) {
        Expression test = transformExpr(node.getTest());
        Expression message = transformExpr(node.getMessage());
        if (test == node.getTest() && message == node.getMessage()) return node;
        return new AssertStmt(node.getLocation(), test, message);
    }

    @Override
    public AstNode visitRaiseStmt(RaiseStmt node, Void ctx) {
        Expression exception = transformExpr(node.getException());
        if (exception == node.getException()) return node;
        return new RaiseStmt(node.getLocation(), exception);
    }

    @Override
    public AstNode visitExpressionStmt(ExpressionStmt node, Void ctx) {
        Expression expression = transformExpr(node.getExpression());
        if (expression == node.getExpression()) return node;
        return new ExpressionStmt(node.getLocation(), expression);
    }
}
