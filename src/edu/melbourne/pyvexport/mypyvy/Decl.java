/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.mypyvy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level declarations of a mypyvy program. {@link #toString()} is the
 * concrete syntax.
 */
public abstract class Decl {

    /**
     * Name the declaration introduces, null for unnamed axioms and
     * initializers.
     */
    public abstract String getName();

    private static String sorts(List<PyvSort> sorts) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < sorts.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(sorts.get(i));
        }
        return sb.append(")").toString();
    }

    private static String mutability(boolean mutable) {
        return mutable ? "mutable" : "immutable";
    }

    private static String label(String name) {
        return name == null ? "" : "[" + name + "] ";
    }

    public static class SortDecl extends Decl {

        private final String name;

        public SortDecl(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String toString() {
            return "sort " + name;
        }
    }

    /**
     * Common part of constants, relations and functions.
     */
    public static abstract class SymbolDecl extends Decl {

        private final String name;
        private final boolean mutable;

        SymbolDecl(String name, boolean mutable) {
            this.name = name;
            this.mutable = mutable;
        }

        @Override
        public String getName() {
            return name;
        }

        public boolean isMutable() {
            return mutable;
        }

        String prefix() {
            return mutability(mutable);
        }
    }

    public static class ConstantDecl extends SymbolDecl {

        private final PyvSort sort;

        public ConstantDecl(String name, PyvSort sort, boolean mutable) {
            super(name, mutable);
            this.sort = sort;
        }

        public PyvSort getSort() {
            return sort;
        }

        @Override
        public String toString() {
            return prefix() + " constant " + getName() + ": " + sort;
        }
    }

    public static class RelationDecl extends SymbolDecl {

        private final List<PyvSort> arity;

        public RelationDecl(String name, List<PyvSort> arity, boolean mutable) {
            super(name, mutable);
            this.arity = Collections.unmodifiableList(new ArrayList<>(arity));
        }

        public List<PyvSort> getArity() {
            return arity;
        }

        @Override
        public String toString() {
            return prefix() + " relation " + getName() + sorts(arity);
        }
    }

    public static class FunctionDecl extends SymbolDecl {

        private final List<PyvSort> domain;
        private final PyvSort range;

        public FunctionDecl(String name, List<PyvSort> domain, PyvSort range, boolean mutable) {
            super(name, mutable);
            this.domain = Collections.unmodifiableList(new ArrayList<>(domain));
            this.range = range;
        }

        public List<PyvSort> getDomain() {
            return domain;
        }

        public PyvSort getRange() {
            return range;
        }

        @Override
        public String toString() {
            return prefix() + " function " + getName() + sorts(domain) + ": " + range;
        }
    }

    public static class AxiomDecl extends Decl {

        private final String name;
        private final PyvExpr expr;

        public AxiomDecl(String name, PyvExpr expr) {
            this.name = name;
            this.expr = expr;
        }

        @Override
        public String getName() {
            return name;
        }

        public PyvExpr getExpr() {
            return expr;
        }

        @Override
        public String toString() {
            return "axiom " + label(name) + expr;
        }
    }

    public static class InitDecl extends Decl {

        private final String name;
        private final PyvExpr expr;

        public InitDecl(String name, PyvExpr expr) {
            this.name = name;
            this.expr = expr;
        }

        @Override
        public String getName() {
            return name;
        }

        public PyvExpr getExpr() {
            return expr;
        }

        @Override
        public String toString() {
            return "init " + label(name) + expr;
        }
    }

    /**
     * A two-state transition with explicit modifies clauses.
     */
    public static class DefinitionDecl extends Decl {

        private final String name;
        private final List<SortedVar> params;
        private final List<String> modifies;
        private final PyvExpr body;

        public DefinitionDecl(String name, List<SortedVar> params, List<String> modifies, PyvExpr body) {
            this.name = name;
            this.params = Collections.unmodifiableList(new ArrayList<>(params));
            this.modifies = Collections.unmodifiableList(new ArrayList<>(modifies));
            this.body = body;
        }

        @Override
        public String getName() {
            return name;
        }

        public List<SortedVar> getParams() {
            return params;
        }

        public List<String> getModifies() {
            return modifies;
        }

        public PyvExpr getBody() {
            return body;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("transition ").append(name).append("(");
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(params.get(i).getName()).append(": ").append(params.get(i).getSort());
            }
            sb.append(")");
            if (!modifies.isEmpty()) {
                sb.append("\n  modifies ");
                for (int i = 0; i < modifies.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append(modifies.get(i));
                }
            }
            return sb.append("\n  ").append(body).toString();
        }
    }

    public static class InvariantDecl extends Decl {

        private final String name;
        private final PyvExpr expr;
        private final boolean safety;
        private final boolean sketch;

        public InvariantDecl(String name, PyvExpr expr, boolean safety, boolean sketch) {
            this.name = name;
            this.expr = expr;
            this.safety = safety;
            this.sketch = sketch;
        }

        @Override
        public String getName() {
            return name;
        }

        public PyvExpr getExpr() {
            return expr;
        }

        public boolean isSafety() {
            return safety;
        }

        public boolean isSketch() {
            return sketch;
        }

        @Override
        public String toString() {
            String kw = safety ? "safety " : "invariant ";
            return (sketch ? "sketch " : "") + kw + label(name) + expr;
        }
    }
}
