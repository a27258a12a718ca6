package com.viperk.compiler.pass;

import com.viperk.compiler.ast.decl.Program;

/**
 * 语法树预处理 pass 接口。
 */
public interface AstPass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 对整棵语法树执行变换，返回新树（无变化时可返回原树）。
     */
    Program run(Program program);
}
