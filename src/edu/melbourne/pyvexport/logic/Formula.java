/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.logic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Formulas and terms of the source logic. Equality is structural.
 * <p>
 * Truth is the empty conjunction and falsity the empty disjunction. The
 * static factories build the canonical forms the solver round trip
 * reproduces: one-element conjunctions and disjunctions collapse to their
 * element and an equation between Boolean terms is an {@link Iff}.
 */
public abstract class Formula {

    public static final And TRUE = new And(Collections.<Formula>emptyList());
    public static final Or FALSE = new Or(Collections.<Formula>emptyList());

    public abstract <T> T accept(Visitor<T> visitor);

    public abstract Sort getSort();

    /**
     * Symbols occurring in this formula, in order of first occurrence.
     */
    public Set<Symbol> symbols() {
        Set<Symbol> res = new LinkedHashSet<>();
        collectSymbols(this, res);
        return res;
    }

    private static void collectSymbols(Formula f, Set<Symbol> res) {
        if (f instanceof Apply) {
            res.add(((Apply) f).getFunc());
        } else if (f instanceof Const) {
            res.add(((Const) f).getSymbol());
        }
        for (Formula ch : f.children()) {
            collectSymbols(ch, res);
        }
    }

    public abstract List<Formula> children();

    public boolean isTrue() {
        return this instanceof And && children().isEmpty();
    }

    public boolean isFalse() {
        return this instanceof Or && children().isEmpty();
    }

    @Override
    public String toString() {
        return FormulaPrinter.print(this);
    }

    // factories
    public static Formula forall(List<Var> vars, Formula body) {
        if (vars.isEmpty()) {
            return body;
        }
        return new ForAll(vars, body);
    }

    public static Formula exists(List<Var> vars, Formula body) {
        if (vars.isEmpty()) {
            return body;
        }
        return new Exists(vars, body);
    }

    public static Formula and(Formula... terms) {
        return and(Arrays.asList(terms));
    }

    public static Formula and(List<Formula> terms) {
        if (terms.size() == 1) {
            return terms.get(0);
        }
        return new And(terms);
    }

    public static Formula or(Formula... terms) {
        return or(Arrays.asList(terms));
    }

    public static Formula or(List<Formula> terms) {
        if (terms.size() == 1) {
            return terms.get(0);
        }
        return new Or(terms);
    }

    public static Formula not(Formula body) {
        return new Not(body);
    }

    public static Formula implies(Formula t1, Formula t2) {
        return new Implies(t1, t2);
    }

    public static Formula iff(Formula t1, Formula t2) {
        return new Iff(t1, t2);
    }

    public static Formula eq(Formula t1, Formula t2) {
        if (t1.getSort() == Sort.BOOL) {
            return new Iff(t1, t2);
        }
        return new Eq(t1, t2);
    }

    public static Formula ite(Formula cond, Formula thenTerm, Formula elseTerm) {
        return new Ite(cond, thenTerm, elseTerm);
    }

    public static Formula app(Symbol func, Formula... args) {
        return app(func, Arrays.asList(args));
    }

    public static Formula app(Symbol func, List<Formula> args) {
        if (args.isEmpty()) {
            return new Const(func);
        }
        return new Apply(func, args);
    }

    public static Const cnst(Symbol sym) {
        return new Const(sym);
    }

    public static Var var(String name, Sort sort) {
        return new Var(name, sort);
    }

    public static abstract class Visitor<T> {

        public final T visitThis(Formula f) {
            return f.accept(this);
        }

        public abstract T visit(ForAll f);

        public abstract T visit(Exists f);

        public abstract T visit(Ite f);

        public abstract T visit(And f);

        public abstract T visit(Or f);

        public abstract T visit(Eq f);

        public abstract T visit(Implies f);

        public abstract T visit(Iff f);

        public abstract T visit(Not f);

        public abstract T visit(Apply f);

        public abstract T visit(Const f);

        public abstract T visit(Var f);
    }

    public static abstract class Quantifier extends Formula {

        private final List<Var> variables;
        private final Formula body;

        Quantifier(List<Var> variables, Formula body) {
            this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
            this.body = body;
        }

        public List<Var> getVariables() {
            return variables;
        }

        public Formula getBody() {
            return body;
        }

        @Override
        public Sort getSort() {
            return Sort.BOOL;
        }

        @Override
        public List<Formula> children() {
            return Collections.singletonList(body);
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || o.getClass() != getClass()) {
                return false;
            }
            Quantifier other = (Quantifier) o;
            return other.variables.equals(variables) && other.body.equals(body);
        }

        @Override
        public int hashCode() {
            return getClass().hashCode() ^ (31 * variables.hashCode() + body.hashCode());
        }
    }

    public static class ForAll extends Quantifier {

        public ForAll(List<Var> variables, Formula body) {
            super(variables, body);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Exists extends Quantifier {

        public Exists(List<Var> variables, Formula body) {
            super(variables, body);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Operators with a fixed list of operands.
     */
    public static abstract class Operator extends Formula {

        private final List<Formula> terms;

        Operator(List<Formula> terms) {
            this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
        }

        public List<Formula> getTerms() {
            return terms;
        }

        @Override
        public List<Formula> children() {
            return terms;
        }

        @Override
        public Sort getSort() {
            return Sort.BOOL;
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || o.getClass() != getClass()) {
                return false;
            }
            return ((Operator) o).terms.equals(terms);
        }

        @Override
        public int hashCode() {
            return getClass().hashCode() ^ terms.hashCode();
        }
    }

    public static class And extends Operator {

        public And(List<Formula> terms) {
            super(terms);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Or extends Operator {

        public Or(List<Formula> terms) {
            super(terms);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Eq extends Operator {

        public Eq(Formula t1, Formula t2) {
            super(Arrays.asList(t1, t2));
        }

        public Formula getT1() {
            return getTerms().get(0);
        }

        public Formula getT2() {
            return getTerms().get(1);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Implies extends Operator {

        public Implies(Formula t1, Formula t2) {
            super(Arrays.asList(t1, t2));
        }

        public Formula getT1() {
            return getTerms().get(0);
        }

        public Formula getT2() {
            return getTerms().get(1);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Iff extends Operator {

        public Iff(Formula t1, Formula t2) {
            super(Arrays.asList(t1, t2));
        }

        public Formula getT1() {
            return getTerms().get(0);
        }

        public Formula getT2() {
            return getTerms().get(1);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Not extends Operator {

        public Not(Formula body) {
            super(Collections.singletonList(body));
        }

        public Formula getBody() {
            return getTerms().get(0);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Conditional term: the sort is the sort of the branches.
     */
    public static class Ite extends Operator {

        public Ite(Formula cond, Formula thenTerm, Formula elseTerm) {
            super(Arrays.asList(cond, thenTerm, elseTerm));
        }

        public Formula getCond() {
            return getTerms().get(0);
        }

        public Formula getThen() {
            return getTerms().get(1);
        }

        public Formula getElse() {
            return getTerms().get(2);
        }

        @Override
        public Sort getSort() {
            return getThen().getSort();
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Apply extends Formula {

        private final Symbol func;
        private final List<Formula> args;

        public Apply(Symbol func, List<Formula> args) {
            if (func.getArity() != args.size() || args.isEmpty()) {
                throw new IllegalArgumentException("applying " + func + " to " + args.size() + " arguments");
            }
            this.func = func;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        public Symbol getFunc() {
            return func;
        }

        public List<Formula> getArgs() {
            return args;
        }

        @Override
        public List<Formula> children() {
            return args;
        }

        @Override
        public Sort getSort() {
            return func.getRange();
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Apply)) {
                return false;
            }
            Apply other = (Apply) o;
            return other.func.equals(func) && other.args.equals(args);
        }

        @Override
        public int hashCode() {
            return 31 * func.hashCode() + args.hashCode();
        }
    }

    /**
     * Occurrence of a global symbol as a term.
     */
    public static class Const extends Formula {

        private final Symbol symbol;

        public Const(Symbol symbol) {
            this.symbol = symbol;
        }

        public Symbol getSymbol() {
            return symbol;
        }

        public String getName() {
            return symbol.getName();
        }

        @Override
        public List<Formula> children() {
            return Collections.emptyList();
        }

        @Override
        public Sort getSort() {
            return symbol.getSort();
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Const && ((Const) o).symbol.equals(symbol);
        }

        @Override
        public int hashCode() {
            return symbol.hashCode() + 7;
        }
    }

    /**
     * Logical variable. Also serves as the binder of quantifiers.
     */
    public static class Var extends Formula {

        private final String name;
        private final Sort sort;

        public Var(String name, Sort sort) {
            this.name = name;
            this.sort = sort;
        }

        public String getName() {
            return name;
        }

        @Override
        public Sort getSort() {
            return sort;
        }

        @Override
        public List<Formula> children() {
            return Collections.emptyList();
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Var)) {
                return false;
            }
            Var other = (Var) o;
            return other.name.equals(name) && other.sort.equals(sort);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + sort.hashCode();
        }
    }
}
