package com.viperk.ir.term;

import java.util.Collections;
import java.util.List;

/**
 * 语句项
 */
public abstract class StmtTerm extends Term {

    public static final StmtTerm BREAK = atom("%break");
    public static final StmtTerm PASS = atom("%pass");
    public static final StmtTerm THROW = atom("%throw");
    public static final StmtTerm RETURN = atom("%return");

    StmtTerm() {
    }

    private static StmtTerm atom(final String text) {
        return new StmtTerm() {
            @Override
            public void render(StringBuilder out) {
                out.append(text);
            }
        };
    }

    /** {@code %vdecl(x, TYPE)}，也用于结构体字段 */
    public static final class VarDecl extends StmtTerm {
        private final String name;
        private final TypeTerm type;

        public VarDecl(String name, TypeTerm type) {
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return name;
        }

        public TypeTerm getType() {
            return type;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%vdecl(").append(name).append(", ");
            type.render(out);
            out.append(')');
        }
    }

    /** {@code %assign(VAR, E)} */
    public static final class Assign extends StmtTerm {
        private final ExprTerm target;
        private final ExprTerm value;

        public Assign(ExprTerm target, ExprTerm value) {
            this.target = target;
            this.value = value;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%assign(");
            target.render(out);
            out.append(", ");
            value.render(out);
            out.append(')');
        }
    }

    /** {@code %augassign(+=, VAR, E)} */
    public static final class AugAssign extends StmtTerm {
        private final String symbol;
        private final ExprTerm target;
        private final ExprTerm value;

        public AugAssign(String symbol, ExprTerm target, ExprTerm value) {
            this.symbol = symbol;
            this.target = target;
            this.value = value;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%augassign(").append(symbol).append(", ");
            target.render(out);
            out.append(", ");
            value.render(out);
            out.append(')');
        }
    }

    /** {@code %if(E,STMTS)} / {@code %if(E,STMTS,STMTS)} */
    public static final class If extends StmtTerm {
        private final ExprTerm condition;
        private final Block thenBlock;
        private final Block elseBlock;

        public If(ExprTerm condition, Block thenBlock, Block elseBlock) {
            this.condition = condition;
            this.thenBlock = thenBlock;
            this.elseBlock = elseBlock;
        }

        public boolean hasElse() {
            return elseBlock != null && !elseBlock.isEmpty();
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%if(");
            condition.render(out);
            out.append(',');
            thenBlock.render(out);
            if (hasElse()) {
                out.append(',');
                elseBlock.render(out);
            }
            out.append(')');
        }
    }

    /** {@code %forrange(i, N,STMTS)} / {@code %forrange(i, A, B,STMTS)} */
    public static final class ForRange extends StmtTerm {
        private final String var;
        private final ExprTerm start;
        private final ExprTerm end;
        private final Block body;

        /**
         * @param start 起始值；单参数 range 时为 null
         */
        public ForRange(String var, ExprTerm start, ExprTerm end, Block body) {
            this.var = var;
            this.start = start;
            this.end = end;
            this.body = body;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%forrange(").append(var).append(", ");
            if (start != null) {
                start.render(out);
                out.append(", ");
            }
            end.render(out);
            out.append(',');
            body.render(out);
            out.append(')');
        }
    }

    /** {@code %forlist(i, E,STMTS)} */
    public static final class ForIter extends StmtTerm {
        private final String var;
        private final ExprTerm iterable;
        private final Block body;

        public ForIter(String var, ExprTerm iterable, Block body) {
            this.var = var;
            this.iterable = iterable;
            this.body = body;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%forlist(").append(var).append(", ");
            iterable.render(out);
            out.append(',');
            body.render(out);
            out.append(')');
        }
    }

    /** {@code %return(E)} */
    public static final class ReturnValue extends StmtTerm {
        private final ExprTerm value;

        public ReturnValue(ExprTerm value) {
            this.value = value;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%return(");
            value.render(out);
            out.append(')');
        }
    }

    /** {@code %assert(E)} */
    public static final class Assert extends StmtTerm {
        private final ExprTerm test;

        public Assert(ExprTerm test) {
            this.test = test;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%assert(");
            test.render(out);
            out.append(')');
        }
    }

    /** {@code %log(Event, E1 E2)} */
    public static final class Log extends StmtTerm {
        private final String event;
        private final List<ExprTerm> args;

        public Log(String event, List<ExprTerm> args) {
            this.event = event;
            this.args = Collections.unmodifiableList(args);
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%log(").append(event).append(", ");
            renderList(out, args, " ");
            out.append(')');
        }
    }

    /** {@code %send(TO, AMOUNT)} */
    public static final class Send extends StmtTerm {
        private final ExprTerm to;
        private final ExprTerm amount;

        public Send(ExprTerm to, ExprTerm amount) {
            this.to = to;
            this.amount = amount;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%send(");
            to.render(out);
            out.append(", ");
            amount.render(out);
            out.append(')');
        }
    }

    /** {@code %selfdestruct(E)} */
    public static final class SelfDestruct extends StmtTerm {
        private final ExprTerm target;

        public SelfDestruct(ExprTerm target) {
            this.target = target;
        }

        @Override
        public void render(StringBuilder out) {
            out.append("%selfdestruct(");
            target.render(out);
            out.append(')');
        }
    }
}
