package com.viperk.ir.term;

import java.util.Collections;
import java.util.List;

/**
 * 程序项 {@code %pgm(EVENTS,GLOBALS,INIT,DEFS\n)}
 *
 * <p>四个分区依次为事件、存储变量、构造函数、普通函数；每项位于第 1 层缩进。
 * 空的事件分区渲染为空串，其余空分区渲染为一个空格。</p>
 */
public final class ProgramTerm extends Term {
    private final List<DeclTerm.Event> events;
    private final List<DeclTerm.Global> globals;
    private final List<DeclTerm.Function> init;
    private final List<DeclTerm.Function> functions;

    public ProgramTerm(List<DeclTerm.Event> events, List<DeclTerm.Global> globals,
                       List<DeclTerm.Function> init, List<DeclTerm.Function> functions) {
        this.events = Collections.unmodifiableList(events);
        this.globals = Collections.unmodifiableList(globals);
        this.init = Collections.unmodifiableList(init);
        this.functions = Collections.unmodifiableList(functions);
    }

    public List<DeclTerm.Event> getEvents() {
        return events;
    }

    public List<DeclTerm.Global> getGlobals() {
        return globals;
    }

    public List<DeclTerm.Function> getInit() {
        return init;
    }

    public List<DeclTerm.Function> getFunctions() {
        return functions;
    }

    @Override
    public void render(StringBuilder out) {
        out.append("%pgm(");
        section(out, events, "");
        out.append(',');
        section(out, globals, " ");
        out.append(',');
        section(out, init, " ");
        out.append(',');
        section(out, functions, " ");
        out.append("\n)");
    }

    private static void section(StringBuilder out, List<? extends Term> items, String emptyCase) {
        if (items.isEmpty()) {
            out.append(emptyCase);
        } else {
            new Block(1, items).render(out);
        }
    }
}
