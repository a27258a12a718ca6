package com.viperk.ir.term;

import java.math.BigInteger;

/**
 * 单位表达式：基本单位及其乘、除、幂
 */
public abstract class UnitTerm extends Term {

    private UnitTerm() {
    }

    /** 基本单位 {@code %wei} */
    public static final class Base extends UnitTerm {
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

    /** {@code %umul(U, V)} / {@code %udiv(U, V)} */
    public static final class Binary extends UnitTerm {
        private final boolean division;
        private final UnitTerm left;
        private final UnitTerm right;

        public Binary(boolean division, UnitTerm left, UnitTerm right) {
            this.division = division;
            this.left = left;
            this.right = right;
        }

        public boolean isDivision() {
            return division;
        }

        @Override
        public void render(StringBuilder out) {
            out.append(division ? "%udiv(" : "%umul(");
            left.render(out);
            out.append(", ");
            right.render(out);
            out.append(')');
        }
    }

    /** {@code %upow(U, N)} */
    public static final class Pow extends UnitTerm {
        private final UnitTerm base;
        private final BigInteger exponent;

        public Pow(UnitTerm base, BigInteger exponent) {
            this.base = base;
            this.exponent = exponent;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%upow(");
            base.render(out);
            out.append(", ").append(exponent).append(')');
        }
    }
}
