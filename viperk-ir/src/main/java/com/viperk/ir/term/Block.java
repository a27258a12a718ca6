package com.viperk.ir.term;

import java.util.Collections;
import java.util.List;

/**
 * 语句块：每条语句前输出换行与 2 × depth 个空格。
 */
public final class Block extends Term {
    private final int depth;
    private final List<? extends Term> items;

    public Block(int depth, List<? extends Term> items) {
        if (depth < 0) {
            throw new IllegalArgumentException("Negative block depth: " + depth);
        }
        this.depth = depth;
        this.items = Collections.unmodifiableList(items);
    }

    public int getDepth() {
        return depth;
    }

    public List<? extends Term> getItems() {
        return items;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public void render(StringBuilder out) {
        for (Term item : items) {
            out.append('\n');
            indent(out, depth);
            item.render(out);
        }
    }

    static void indent(StringBuilder out, int depth) {
        for (int i = 0; i < depth; i++) {
            out.append("  ");
        }
    }
}
