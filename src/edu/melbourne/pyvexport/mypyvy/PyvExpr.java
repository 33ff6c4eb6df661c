/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.mypyvy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Expressions of the mypyvy language. Global symbols and variables are both
 * plain identifiers; the post-state of a global is marked by {@code new(...)}.
 */
public abstract class PyvExpr {

    public static final Bool TRUE = new Bool(true);
    public static final Bool FALSE = new Bool(false);

    public abstract <T> T accept(Visitor<T> visitor);

    @Override
    public String toString() {
        return PyvPrinter.print(this);
    }

    public static PyvExpr id(String name) {
        return new Id(name);
    }

    public static PyvExpr not(PyvExpr e) {
        return new UnaryExpr(UnaryExpr.Op.NOT, e);
    }

    public static PyvExpr newOf(PyvExpr e) {
        return new UnaryExpr(UnaryExpr.Op.NEW, e);
    }

    public static PyvExpr and(PyvExpr... args) {
        return new NaryExpr(NaryExpr.Op.AND, Arrays.asList(args));
    }

    public static PyvExpr and(List<PyvExpr> args) {
        return new NaryExpr(NaryExpr.Op.AND, args);
    }

    public static PyvExpr or(List<PyvExpr> args) {
        return new NaryExpr(NaryExpr.Op.OR, args);
    }

    public static PyvExpr distinct(List<PyvExpr> args) {
        return new NaryExpr(NaryExpr.Op.DISTINCT, args);
    }

    public static PyvExpr binary(BinaryExpr.Op op, PyvExpr arg1, PyvExpr arg2) {
        return new BinaryExpr(op, arg1, arg2);
    }

    public static PyvExpr app(String callee, List<PyvExpr> args) {
        return new AppExpr(callee, args);
    }

    public static PyvExpr forall(List<SortedVar> vars, PyvExpr body) {
        return new QuantifierExpr(QuantifierExpr.Quant.FORALL, vars, body);
    }

    public static PyvExpr exists(List<SortedVar> vars, PyvExpr body) {
        return new QuantifierExpr(QuantifierExpr.Quant.EXISTS, vars, body);
    }

    public static abstract class Visitor<T> {

        public final T visitThis(PyvExpr e) {
            return e.accept(this);
        }

        public abstract T visit(Bool e);

        public abstract T visit(Id e);

        public abstract T visit(UnaryExpr e);

        public abstract T visit(BinaryExpr e);

        public abstract T visit(NaryExpr e);

        public abstract T visit(AppExpr e);

        public abstract T visit(QuantifierExpr e);

        public abstract T visit(IfThenElse e);
    }

    public static class Bool extends PyvExpr {

        private final boolean value;

        private Bool(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Id extends PyvExpr {

        private final String name;

        public Id(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Id && ((Id) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    public static class UnaryExpr extends PyvExpr {

        public enum Op {
            NOT, NEW
        }

        private final Op op;
        private final PyvExpr arg;

        public UnaryExpr(Op op, PyvExpr arg) {
            this.op = op;
            this.arg = arg;
        }

        public Op getOp() {
            return op;
        }

        public PyvExpr getArg() {
            return arg;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof UnaryExpr)) {
                return false;
            }
            UnaryExpr other = (UnaryExpr) o;
            return other.op == op && other.arg.equals(arg);
        }

        @Override
        public int hashCode() {
            return 31 * op.hashCode() + arg.hashCode();
        }
    }

    public static class BinaryExpr extends PyvExpr {

        public enum Op {
            IMPLIES("->"), IFF("<->"), EQUAL("="), NOTEQ("!=");

            private final String text;

            Op(String text) {
                this.text = text;
            }

            public String getText() {
                return text;
            }
        }

        private final Op op;
        private final PyvExpr arg1;
        private final PyvExpr arg2;

        public BinaryExpr(Op op, PyvExpr arg1, PyvExpr arg2) {
            this.op = op;
            this.arg1 = arg1;
            this.arg2 = arg2;
        }

        public Op getOp() {
            return op;
        }

        public PyvExpr getArg1() {
            return arg1;
        }

        public PyvExpr getArg2() {
            return arg2;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof BinaryExpr)) {
                return false;
            }
            BinaryExpr other = (BinaryExpr) o;
            return other.op == op && other.arg1.equals(arg1) && other.arg2.equals(arg2);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * op.hashCode() + arg1.hashCode()) + arg2.hashCode();
        }
    }

    public static class NaryExpr extends PyvExpr {

        public enum Op {
            AND, OR, DISTINCT
        }

        private final Op op;
        private final List<PyvExpr> args;

        public NaryExpr(Op op, List<PyvExpr> args) {
            this.op = op;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        public Op getOp() {
            return op;
        }

        public List<PyvExpr> getArgs() {
            return args;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof NaryExpr)) {
                return false;
            }
            NaryExpr other = (NaryExpr) o;
            return other.op == op && other.args.equals(args);
        }

        @Override
        public int hashCode() {
            return 31 * op.hashCode() + args.hashCode();
        }
    }

    public static class AppExpr extends PyvExpr {

        private final String callee;
        private final List<PyvExpr> args;

        public AppExpr(String callee, List<PyvExpr> args) {
            this.callee = callee;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        public String getCallee() {
            return callee;
        }

        public List<PyvExpr> getArgs() {
            return args;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof AppExpr)) {
                return false;
            }
            AppExpr other = (AppExpr) o;
            return other.callee.equals(callee) && other.args.equals(args);
        }

        @Override
        public int hashCode() {
            return 31 * callee.hashCode() + args.hashCode();
        }
    }

    public static class QuantifierExpr extends PyvExpr {

        public enum Quant {
            FORALL, EXISTS
        }

        private final Quant quant;
        private final List<SortedVar> vars;
        private final PyvExpr body;

        public QuantifierExpr(Quant quant, List<SortedVar> vars, PyvExpr body) {
            this.quant = quant;
            this.vars = Collections.unmodifiableList(new ArrayList<>(vars));
            this.body = body;
        }

        public Quant getQuant() {
            return quant;
        }

        public List<SortedVar> getVars() {
            return vars;
        }

        public PyvExpr getBody() {
            return body;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof QuantifierExpr)) {
                return false;
            }
            QuantifierExpr other = (QuantifierExpr) o;
            return other.quant == quant && other.vars.equals(vars) && other.body.equals(body);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * quant.hashCode() + vars.hashCode()) + body.hashCode();
        }
    }

    public static class IfThenElse extends PyvExpr {

        private final PyvExpr branch;
        private final PyvExpr then;
        private final PyvExpr els;

        public IfThenElse(PyvExpr branch, PyvExpr then, PyvExpr els) {
            this.branch = branch;
            this.then = then;
            this.els = els;
        }

        public PyvExpr getBranch() {
            return branch;
        }

        public PyvExpr getThen() {
            return then;
        }

        public PyvExpr getEls() {
            return els;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof IfThenElse)) {
                return false;
            }
            IfThenElse other = (IfThenElse) o;
            return other.branch.equals(branch) && other.then.equals(then) && other.els.equals(els);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * branch.hashCode() + then.hashCode()) + els.hashCode();
        }
    }
}
