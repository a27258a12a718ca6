package com.viperk.ir.term;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * 类型项
 */
public abstract class TypeTerm extends Term {

    public static final TypeTerm VOID = new TypeTerm() {
        @Override
        public void render(StringBuilder out) {
            out.append("%void");
        }
    };

    TypeTerm() {
    }

    /** 基础类型：{@code %num}、{@code %address} 等，名称不做检查 */
    public static final class Base extends TypeTerm {
        private final String name;

        public Base(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public void render(StringBuilder out) {
            out.append('%').append(name);
        }
    }

    /** {@code %listT(ELEM, LEN)}：长度按常量渲染，十六进制写法保留为 {@code %hex(...)} */
    public static final class ListOf extends TypeTerm {
        private final TypeTerm element;
        private final ExprTerm length;

        public ListOf(TypeTerm element, ExprTerm length) {
            this.element = element;
            this.length = length;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%listT(");
            element.render(out);
            out.append(", ");
            length.render(out);
            out.append(')');
        }
    }

    /** {@code %mapT(VALUE, KEY)}：先写被下标的类型，再写下标类型 */
    public static final class MapOf extends TypeTerm {
        private final TypeTerm value;
        private final TypeTerm key;

        public MapOf(TypeTerm value, TypeTerm key) {
            this.value = value;
            this.key = key;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%mapT(");
            value.render(out);
            out.append(", ");
            key.render(out);
            out.append(')');
        }
    }

    /** {@code %bytesT(N)} */
    public static final class ByteArray extends TypeTerm {
        private final BigInteger maxLength;

        public ByteArray(BigInteger maxLength) {
            this.maxLength = maxLength;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%bytesT(").append(maxLength).append(')');
        }
    }

    /** {@code %unitT(%num, UNIT, positional)} */
    public static final class WithUnit extends TypeTerm {
        private final String numType;
        private final UnitTerm unit;
        private final boolean positional;

        public WithUnit(String numType, UnitTerm unit, boolean positional) {
            this.numType = numType;
            this.unit = unit;
            this.positional = positional;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%unitT(%").append(numType).append(", ");
            unit.render(out);
            out.append(", ").append(positional).append(')');
        }
    }

    /** {@code %structT(%vdecl(f, T) %vdecl(g, U))} */
    public static final class Struct extends TypeTerm {
        private final List<StmtTerm.VarDecl> fields;

        public Struct(List<StmtTerm.VarDecl> fields) {
            this.fields = Collections.unmodifiableList(fields);
        }

        public List<StmtTerm.VarDecl> getFields() {
            return fields;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%structT(");
            renderList(out, fields, " ");
            out.append(')');
        }
    }
}
