package com.viperk.ir.translate;

import com.viperk.compiler.ast.decl.Decorator;
import com.viperk.compiler.ast.decl.FunDecl;
import com.viperk.compiler.ast.decl.Parameter;
import com.viperk.compiler.ast.decl.Program;
import com.viperk.compiler.ast.expr.CallExpr;
import com.viperk.compiler.ast.expr.DictLiteral;
import com.viperk.compiler.ast.expr.Expression;
import com.viperk.compiler.ast.expr.Name;
import com.viperk.compiler.ast.stmt.AnnAssignStmt;
import com.viperk.compiler.ast.stmt.Statement;
import com.viperk.ir.term.Block;
import com.viperk.ir.term.DeclTerm;
import com.viperk.ir.term.DeclTerm.Visibility;
import com.viperk.ir.term.ProgramTerm;
import com.viperk.ir.term.TypeTerm;

import java.util.ArrayList;
import java.util.List;

/**
 * 程序组装：一次从左到右扫描顶层语句，归入事件、存储变量、构造函数与普通函数四类。
 *
 * <pre>
 * Transfer: __log__({_from: indexed(address), _value: num256})  → %event(...)
 * total: public(num256)                                        → %svdecl(total, %num256, %public)
 * def __init__(): ...                                          → 构造函数分区
 * def transfer(...): ...                                       → 函数分区
 * </pre>
 */
public final class ProgramTranslator {

    /** 顶层声明所在层级；函数体位于其下一层 */
    static final int TOP_LEVEL_DEPTH = 1;

    private final TypeTranslator typeTranslator;
    private final StmtTranslator stmtTranslator;

    public ProgramTranslator(SourceLines sourceLines) {
        ConstTranslator constTranslator = new ConstTranslator(sourceLines);
        this.typeTranslator = new TypeTranslator(constTranslator);
        ExprTranslator exprTranslator = new ExprTranslator(constTranslator);
        this.stmtTranslator = new StmtTranslator(exprTranslator, typeTranslator);
    }

    public ProgramTerm translate(Program program) {
        List<DeclTerm.Event> events = new ArrayList<DeclTerm.Event>();
        List<DeclTerm.Global> globals = new ArrayList<DeclTerm.Global>();
        List<DeclTerm.Function> init = new ArrayList<DeclTerm.Function>();
        List<DeclTerm.Function> functions = new ArrayList<DeclTerm.Function>();

        for (Statement stmt : program.getBody()) {
            if (stmt instanceof AnnAssignStmt) {
                AnnAssignStmt decl = (AnnAssignStmt) stmt;
                if (isEventDecl(decl)) {
                    events.add(translateEvent(decl));
                } else {
                    globals.add(translateGlobal(decl));
                }
            } else if (stmt instanceof FunDecl) {
                FunDecl fun = (FunDecl) stmt;
                if (OperatorTables.CONSTRUCTOR.equals(fun.getName())) {
                    init.add(translateFunction(fun));
                } else {
                    functions.add(translateFunction(fun));
                }
            } else {
                throw UnsupportedConstructException.structural(
                        "Top level may only contain declarations and function definitions", stmt.getLocation());
            }
        }
        return new ProgramTerm(events, globals, init, functions);
    }

    private static boolean isEventDecl(AnnAssignStmt decl) {
        return decl.getAnnotation() instanceof CallExpr
                && ((CallExpr) decl.getAnnotation()).isCallTo(OperatorTables.EVENT_MARKER);
    }

    // ==================== 事件 ====================

    private DeclTerm.Event translateEvent(AnnAssignStmt decl) {
        String name = declaredName(decl);
        CallExpr marker = (CallExpr) decl.getAnnotation();
        List<Expression> args = marker.getPositionalValues();
        if (marker.hasNamedArgs() || args.size() != 1 || !(args.get(0) instanceof DictLiteral)) {
            throw UnsupportedConstructException.detail(
                    "Event declaration expects a single dict of parameters", marker.getLocation());
        }
        List<DeclTerm.EventParam> params = new ArrayList<DeclTerm.EventParam>();
        for (DictLiteral.Entry entry : ((DictLiteral) args.get(0)).getEntries()) {
            params.add(translateEventParam(entry));
        }
        return new DeclTerm.Event(name, params);
    }

    private DeclTerm.EventParam translateEventParam(DictLiteral.Entry entry) {
        if (!(entry.getKey() instanceof Name)) {
            throw UnsupportedConstructException.detail(
                    "Event parameter name must be a simple name", entry.getKey().getLocation());
        }
        String name = ((Name) entry.getKey()).getId();
        Expression value = entry.getValue();
        if (value instanceof CallExpr && ((CallExpr) value).isCallTo(OperatorTables.INDEXED)) {
            List<Expression> args = ((CallExpr) value).getPositionalValues();
            if (((CallExpr) value).hasNamedArgs() || args.size() != 1) {
                throw UnsupportedConstructException.detail(
                        "indexed() expects exactly one type", value.getLocation());
            }
            return new DeclTerm.EventParam(name, typeTranslator.translate(args.get(0)), true);
        }
        return new DeclTerm.EventParam(name, typeTranslator.translate(value), false);
    }

    // ==================== 存储变量 ====================

    private DeclTerm.Global translateGlobal(AnnAssignStmt decl) {
        String name = declaredName(decl);
        if (decl.hasValue()) {
            throw UnsupportedConstructException.detail(
                    "Storage variables cannot have an initial value", decl.getLocation());
        }
        Expression annotation = decl.getAnnotation();
        if (annotation instanceof CallExpr && ((CallExpr) annotation).getCallee() instanceof Name) {
            CallExpr wrapper = (CallExpr) annotation;
            String wrapperName = ((Name) wrapper.getCallee()).getId();
            if (OperatorTables.isVisibilityWrapper(wrapperName)) {
                List<Expression> args = wrapper.getPositionalValues();
                if (wrapper.hasNamedArgs() || args.size() != 1) {
                    throw UnsupportedConstructException.detail(
                            wrapperName + "() expects exactly one type", wrapper.getLocation());
                }
                Visibility visibility = "public".equals(wrapperName) ? Visibility.PUBLIC : Visibility.PRIVATE;
                return new DeclTerm.Global(name, typeTranslator.translate(args.get(0)), visibility);
            }
        }
        return new DeclTerm.Global(name, typeTranslator.translate(annotation), Visibility.PRIVATE);
    }

    private static String declaredName(AnnAssignStmt decl) {
        if (!(decl.getTarget() instanceof Name)) {
            throw UnsupportedConstructException.detail(
                    "Top level declaration target must be a simple name", decl.getTarget().getLocation());
        }
        return ((Name) decl.getTarget()).getId();
    }

    // ==================== 函数 ====================

    private DeclTerm.Function translateFunction(FunDecl fun) {
        List<String> decorators = new ArrayList<String>();
        for (Decorator decorator : fun.getDecorators()) {
            if (!(decorator.getExpression() instanceof Name)) {
                throw UnsupportedConstructException.detail(
                        "Decorators must be simple names", decorator.getLocation());
            }
            decorators.add(((Name) decorator.getExpression()).getId());
        }

        List<DeclTerm.Param> params = new ArrayList<DeclTerm.Param>();
        for (Parameter param : fun.getParams()) {
            if (!param.hasAnnotation()) {
                throw UnsupportedConstructException.detail(
                        "Parameter '" + param.getName() + "' needs a type annotation", param.getLocation());
            }
            if (param.hasDefaultValue()) {
                throw UnsupportedConstructException.detail(
                        "Default parameter values are not supported", param.getDefaultValue().getLocation());
            }
            params.add(new DeclTerm.Param(param.getName(), typeTranslator.translate(param.getAnnotation())));
        }

        TypeTerm returnType = typeTranslator.translate(fun.getReturns());
        Block body = stmtTranslator.translateBlock(fun.getBody(), TOP_LEVEL_DEPTH + 1);
        return new DeclTerm.Function(decorators, fun.getName(), params, returnType, body);
    }
}
