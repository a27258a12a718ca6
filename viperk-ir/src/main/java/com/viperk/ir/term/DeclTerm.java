package com.viperk.ir.term;

import java.util.Collections;
import java.util.List;

/**
 * 顶层声明项：事件、存储变量、函数
 */
public abstract class DeclTerm extends Term {

    DeclTerm() {
    }

    /** {@code %event(Name, P1 P2)} */
    public static final class Event extends DeclTerm {
        private final String name;
        private final List<EventParam> params;

        public Event(String name, List<EventParam> params) {
            this.name = name;
            this.params = Collections.unmodifiableList(params);
        }

        public String getName() {
            return name;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%event(").append(name).append(", ");
            renderList(out, params, " ");
            out.append(')');
        }
    }

    /** {@code %eparam(name, TYPE, indexed)} */
    public static final class EventParam extends Term {
        private final String name;
        private final TypeTerm type;
        private final boolean indexed;

        public EventParam(String name, TypeTerm type, boolean indexed) {
            this.name = name;
            this.type = type;
            this.indexed = indexed;
        }

        public boolean isIndexed() {
            return indexed;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%eparam(").append(name).append(", ");
            type.render(out);
            out.append(", ").append(indexed).append(')');
        }
    }

    /** 存储变量可见性，缺省为私有 */
    public enum Visibility {
        PUBLIC("%public"),
        PRIVATE("%private");

        private final String symbol;

        Visibility(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    /** {@code %svdecl(name, TYPE, %public|%private)} */
    public static final class Global extends DeclTerm {
        private final String name;
        private final TypeTerm type;
        private final Visibility visibility;

        public Global(String name, TypeTerm type, Visibility visibility) {
            this.name = name;
            this.type = type;
            this.visibility = visibility;
        }

        public String getName() {
            return name;
        }

        public Visibility getVisibility() {
            return visibility;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%svdecl(").append(name).append(", ");
            type.render(out);
            out.append(", ").append(visibility.getSymbol()).append(')');
        }
    }

    /** {@code %param(n, TYPE)} */
    public static final class Param extends Term {
        private final String name;
        private final TypeTerm type;

        public Param(String name, TypeTerm type) {
            this.name = name;
            this.type = type;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%param(").append(name).append(", ");
            type.render(out);
            out.append(')');
        }
    }

    /** {@code %fdecl(DECOS, name, PARAMS, RTYPE,STMTS)} */
    public static final class Function extends DeclTerm {
        private final List<String> decorators;
        private final String name;
        private final List<Param> params;
        private final TypeTerm returnType;
        private final Block body;

        public Function(List<String> decorators, String name, List<Param> params,
                        TypeTerm returnType, Block body) {
            this.decorators = Collections.unmodifiableList(decorators);
            this.name = name;
            this.params = Collections.unmodifiableList(params);
            this.returnType = returnType;
            this.body = body;
        }

        public String getName() {
            return name;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%fdecl(");
            for (int i = 0; i < decorators.size(); i++) {
                if (i > 0) out.append(' ');
                out.append("%@").append(decorators.get(i));
            }
            out.append(", ").append(name).append(", ");
            renderList(out, params, " ");
            out.append(", ");
            returnType.render(out);
            out.append(',');
            body.render(out);
            out.append(')');
        }
    }
}
