package com.viperk.compiler.ast;

import com.viperk.compiler.ast.decl.Program;

/**
 * 完整语法树访问者：表达式 + 语句 + 编译单元
 */
public interface AstVisitor<R, C> extends ExprVisitor<R, C>, StmtVisitor<R, C> {

    R visitProgram(Program node, C ctx);
}
