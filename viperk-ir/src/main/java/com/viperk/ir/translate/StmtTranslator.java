package com.viperk.ir.translate;

import com.viperk.compiler.ast.StmtVisitor;
import com.viperk.compiler.ast.decl.FunDecl;
import com.viperk.compiler.ast.expr.*;
import com.viperk.compiler.ast.stmt.*;
import com.viperk.ir.term.Block;
import com.viperk.ir.term.ExprTerm;
import com.viperk.ir.term.StmtTerm;

import java.util.ArrayList;
import java.util.List;

/**
 * 语句翻译。上下文参数为语句自身所在的缩进层级，嵌套语句块位于其下一层。
 */
public final class StmtTranslator implements StmtVisitor<StmtTerm, Integer> {

    private static final String RANGE = "range";
    private static final String LOG = "log";
    private static final String SEND = "send";
    private static final String SELFDESTRUCT = "selfdestruct";
    private static final String THROW = "throw";

    private final ExprTranslator exprTranslator;
    private final TypeTranslator typeTranslator;

    public StmtTranslator(ExprTranslator exprTranslator, TypeTranslator typeTranslator) {
        this.exprTranslator = exprTranslator;
        this.typeTranslator = typeTranslator;
    }

    /**
     * 把一组语句翻译为位于 depth 层的语句块
     */
    public Block translateBlock(List<Statement> stmts, int depth) {
        List<StmtTerm> items = new ArrayList<StmtTerm>(stmts.size());
        for (Statement stmt : stmts) {
            items.add(stmt.accept(this, depth));
        }
        return new Block(depth, items);
    }

    private ExprTerm expr(Expression expr) {
        return exprTranslator.translate(expr);
    }

    private ExprTerm assignTarget(Expression target) {
        if (!ExprTranslator.isVarShape(target)) {
            throw UnsupportedConstructException.detail(
                    "Assignment target must be a variable, attribute or subscript", target.getLocation());
        }
        return exprTranslator.translateVar(target);
    }

    // ==================== 声明与赋值 ====================

    @Override
    public StmtTerm visitAnnAssignStmt(AnnAssignStmt node, Integer depth) {
        if (node.hasValue()) {
            throw UnsupportedConstructException.detail(
                    "Declarations with an initial value are not supported", node.getLocation());
        }
        Expression annotation = node.getAnnotation();
        if (annotation instanceof CallExpr) {
            Expression callee = ((CallExpr) annotation).getCallee();
            if (callee instanceof Name && (OperatorTables.isVisibilityWrapper(((Name) callee).getId())
                    || OperatorTables.EVENT_MARKER.equals(((Name) callee).getId()))) {
                throw UnsupportedConstructException.detail(
                        "'" + ((Name) callee).getId() + "' is only allowed at top level", annotation.getLocation());
            }
        }
        return typeTranslator.translateVarDecl(node.getTarget(), annotation);
    }

    @Override
    public StmtTerm visitAssignStmt(AssignStmt node, Integer depth) {
        if (node.getTargets().size() != 1) {
            throw UnsupportedConstructException.detail(
                    "Chained assignment is not supported", node.getLocation());
        }
        return new StmtTerm.Assign(assignTarget(node.getTargets().get(0)), expr(node.getValue()));
    }

    @Override
    public StmtTerm visitAugAssignStmt(AugAssignStmt node, Integer depth) {
        String symbol = OperatorTables.augAssignSymbol(node.getOperator());
        if (symbol == null) {
            throw UnsupportedConstructException.detail(
                    "Unsupported augmented assignment operator", node.getLocation());
        }
        return new StmtTerm.AugAssign(symbol, assignTarget(node.getTarget()), expr(node.getValue()));
    }

    // ==================== 控制流 ====================

    @Override
    public StmtTerm visitIfStmt(IfStmt node, Integer depth) {
        ExprTerm condition = expr(node.getCondition());
        Block thenBlock = translateBlock(node.getBody(), depth + 1);
        Block elseBlock = node.hasElse() ? translateBlock(node.getOrElse(), depth + 1) : null;
        return new StmtTerm.If(condition, thenBlock, elseBlock);
    }

    @Override
    public StmtTerm visitForStmt(ForStmt node, Integer depth) {
        if (node.hasElse()) {
            throw UnsupportedConstructException.structural("for ... else is not supported", node.getLocation());
        }
        if (!(node.getTarget() instanceof Name)) {
            throw UnsupportedConstructException.detail(
                    "Loop variable must be a simple name", node.getTarget().getLocation());
        }
        String var = ((Name) node.getTarget()).getId();
        Expression iterable = node.getIterable();

        if (iterable instanceof CallExpr && ((CallExpr) iterable).isCallTo(RANGE)) {
            CallExpr range = (CallExpr) iterable;
            List<ExprTerm> args = exprTranslator.translateArgs(range);
            if (args.size() == 1) {
                return new StmtTerm.ForRange(var, null, args.get(0), translateBlock(node.getBody(), depth + 1));
            }
            if (args.size() == 2) {
                return new StmtTerm.ForRange(var, args.get(0), args.get(1),
                        translateBlock(node.getBody(), depth + 1));
            }
            throw UnsupportedConstructException.detail(
                    "range() expects one or two arguments", range.getLocation());
        }
        return new StmtTerm.ForIter(var, expr(iterable), translateBlock(node.getBody(), depth + 1));
    }

    @Override
    public StmtTerm visitWhileStmt(WhileStmt node, Integer depth) {
        throw UnsupportedConstructException.structural("while loops are not supported", node.getLocation());
    }

    @Override
    public StmtTerm visitBreakStmt(BreakStmt node, Integer depth) {
        return StmtTerm.BREAK;
    }

    @Override
    public StmtTerm visitContinueStmt(ContinueStmt node, Integer depth) {
        throw UnsupportedConstructException.structural("continue is not supported", node.getLocation());
    }

    @Override
    public StmtTerm visitPassStmt(PassStmt node, Integer depth) {
        return StmtTerm.PASS;
    }

    @Override
    public StmtTerm visitReturnStmt(ReturnStmt node, Integer depth) {
        if (!node.hasValue()) {
            return StmtTerm.RETURN;
        }
        return new StmtTerm.ReturnValue(expr(node.getValue()));
    }

    @Override
    public StmtTerm visitAssertStmt(AssertStmt node, Integer depth) {
        if (node.hasMessage()) {
            throw UnsupportedConstructException.detail("assert messages are not supported", node.getLocation());
        }
        return new StmtTerm.Assert(expr(node.getTest()));
    }

    @Override
    public StmtTerm visitRaiseStmt(RaiseStmt node, Integer depth) {
        throw UnsupportedConstructException.structural("raise is not supported, use throw", node.getLocation());
    }

    @Override
    public StmtTerm visitFunDecl(FunDecl node, Integer depth) {
        throw UnsupportedConstructException.structural(
                "Function definitions are only allowed at top level", node.getLocation());
    }

    // ==================== 表达式语句 ====================

    /**
     * 仅支持 throw、log.Event(...)、send(to, amount) 与 selfdestruct(target)
     */
    @Override
    public StmtTerm visitExpressionStmt(ExpressionStmt node, Integer depth) {
        Expression expression = node.getExpression();
        if (Name.is(expression, THROW)) {
            return StmtTerm.THROW;
        }
        if (expression instanceof CallExpr) {
            CallExpr call = (CallExpr) expression;
            Expression callee = call.getCallee();
            if (callee instanceof AttributeExpr && Name.is(((AttributeExpr) callee).getTarget(), LOG)) {
                return new StmtTerm.Log(((AttributeExpr) callee).getAttr(), exprTranslator.translateArgs(call));
            }
            if (call.isCallTo(SEND)) {
                List<ExprTerm> args = exprTranslator.translateArgs(call);
                if (args.size() != 2) {
                    throw UnsupportedConstructException.detail(
                            "send expects a recipient and an amount", call.getLocation());
                }
                return new StmtTerm.Send(args.get(0), args.get(1));
            }
            if (call.isCallTo(SELFDESTRUCT)) {
                List<ExprTerm> args = exprTranslator.translateArgs(call);
                if (args.size() != 1) {
                    throw UnsupportedConstructException.detail(
                            "selfdestruct expects exactly one argument", call.getLocation());
                }
                return new StmtTerm.SelfDestruct(args.get(0));
            }
        }
        throw UnsupportedConstructException.structural("Unsupported expression statement", node.getLocation());
    }
}
