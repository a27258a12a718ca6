package com.viperk.compiler.ast;

import com.viperk.compiler.ast.decl.FunDecl;
import com.viperk.compiler.ast.stmt.*;

/**
 * 语句访问者接口（同样没有默认实现）
 */
public interface StmtVisitor<R, C> {

    R visitFunDecl(FunDecl node, C ctx);

    R visitAnnAssignStmt(AnnAssignStmt node, C ctx);

    R visitAssignStmt(AssignStmt node, C ctx);

    R visitAugAssignStmt(AugAssignStmt node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitForStmt(ForStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitBreakStmt(BreakStmt node, C ctx);

    R visitContinueStmt(ContinueStmt node, C ctx);

    R visitPassStmt(PassStmt node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);

    R visitAssertStmt(AssertStmt node, C ctx);

    R visitRaiseStmt(RaiseStmt node, C ctx);

    R visitExpressionStmt(ExpressionStmt node, C ctx);
}
