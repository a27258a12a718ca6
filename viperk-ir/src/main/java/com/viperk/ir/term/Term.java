package com.viperk.ir.term;

import java.util.List;

/**
 * IR 项基类：每个节点渲染为固定的前缀形式 {@code %tag(arg1, arg2, ...)}。
 *
 * <p>渲染只依赖节点自身字段，无副作用。</p>
 */
public abstract class Term {

    /**
     * 把本项追加到输出缓冲
     */
    public abstract void render(StringBuilder out);

    public String render() {
        StringBuilder sb = new StringBuilder();
        render(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }

    /**
     * 按分隔符拼接一组项；空列表不输出任何内容
     */
    protected static void renderList(StringBuilder out, List<? extends Term> terms, String separator) {
        for (int i = 0; i < terms.size(); i++) {
            if (i > 0) out.append(separator);
            terms.get(i).render(out);
        }
    }
}
