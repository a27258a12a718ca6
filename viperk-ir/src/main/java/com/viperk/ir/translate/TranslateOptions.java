package com.viperk.ir.translate;

/**
 * 翻译配置
 */
public class TranslateOptions {
    private boolean foldNegativeLiterals = true;

    public TranslateOptions() {
    }

    /**
     * 预处理阶段是否把 -<数值字面量> 折叠为负值字面量
     */
    public boolean isFoldNegativeLiterals() {
        return foldNegativeLiterals;
    }

    public void setFoldNegativeLiterals(boolean foldNegativeLiterals) {
        this.foldNegativeLiterals = foldNegativeLiterals;
    }
}
