/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import edu.melbourne.pyvexport.logic.Formula;
import edu.melbourne.pyvexport.logic.Naming;
import edu.melbourne.pyvexport.logic.Sort;
import edu.melbourne.pyvexport.logic.Symbol;
import edu.melbourne.pyvexport.mypyvy.Decl;
import edu.melbourne.pyvexport.mypyvy.PyvExpr;
import edu.melbourne.pyvexport.mypyvy.PyvSort;
import edu.melbourne.pyvexport.mypyvy.SortedVar;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Translation of source sorts, binders, symbols and formulas to mypyvy.
 * <p>
 * In two-state mode a {@code new_} symbol becomes {@code new(...)} around the
 * pre-state symbol: mypyvy declares each symbol once and marks post-state
 * references syntactically.
 */
public class LogicToPyv extends Formula.Visitor<PyvExpr> {

    private final boolean twoState;

    private LogicToPyv(boolean twoState) {
        this.twoState = twoState;
    }

    public static PyvExpr translate(Formula f, boolean twoState) {
        return new LogicToPyv(twoState).visitThis(f);
    }

    public static PyvExpr translate(Formula f) {
        return translate(f, false);
    }

    /**
     * Sort of a variable, constant or range.
     */
    public static PyvSort translateSort(Sort s) {
        if (s == Sort.BOOL) {
            return PyvSort.BOOL;
        }
        if (s instanceof Sort.UninterpretedSort || s instanceof Sort.EnumeratedSort) {
            return PyvSort.uninterpreted(NameTable.translateName(s.getName()));
        }
        throw new UnsupportedSortException("translating sort " + s + " to mypyvy", s);
    }

    public static List<PyvSort> translateSorts(List<Sort> sorts) {
        List<PyvSort> res = new ArrayList<>(sorts.size());
        for (Sort s : sorts) {
            res.add(translateSort(s));
        }
        return res;
    }

    public static List<SortedVar> translateBinders(List<Formula.Var> binders) {
        List<SortedVar> res = new ArrayList<>(binders.size());
        for (Formula.Var v : binders) {
            res.add(new SortedVar(NameTable.translateName(v.getName()), translateSort(v.getSort())));
        }
        return res;
    }

    /**
     * First-order witnesses as parameters or existentially bound variables.
     * Their names are bound in {@code scope}, so two witnesses, or a witness
     * and a global, with the same mypyvy name are rejected.
     */
    public static List<SortedVar> translateParams(List<Symbol> witnesses, NameTable scope) {
        List<SortedVar> res = new ArrayList<>(witnesses.size());
        for (Symbol s : witnesses) {
            res.add(new SortedVar(scope.bind(s.getName()), translateSort(s.getSort())));
        }
        return res;
    }

    public static Decl translateSymbolDecl(Symbol sym, boolean mutable) {
        String name = NameTable.translateName(sym.getName());
        switch (sym.getKind()) {
            case INDIVIDUAL:
                return new Decl.ConstantDecl(name, translateSort(sym.getSort()), mutable);
            case RELATION:
                return new Decl.RelationDecl(name, translateSorts(((Sort.FunctionSort) sym.getSort()).getDomain()), mutable);
            case FUNCTION:
                Sort.FunctionSort fs = (Sort.FunctionSort) sym.getSort();
                return new Decl.FunctionDecl(name, translateSorts(fs.getDomain()), translateSort(fs.getRange()), mutable);
            default:
                throw new UnsupportedSortException("translating symbol " + sym + " to mypyvy", sym);
        }
    }

    /**
     * Names of the symbols occurring in {@code f}.
     */
    public static Set<String> globalsInFormula(Formula f) {
        Set<String> res = new LinkedHashSet<>();
        for (Symbol s : f.symbols()) {
            res.add(s.getName());
        }
        return res;
    }

    /**
     * Members of {@code globals} that occur underneath {@code new(...)} in
     * {@code expr}. This is how mypyvy decides what a transition modifies, so it
     * over-approximates: in {@code new(r(c))} the constant {@code c} counts.
     */
    public static Set<String> globalsUnderNew(final Set<String> globals, PyvExpr expr) {
        final Set<String> res = new LinkedHashSet<>();
        new PyvExpr.Visitor<Void>() {
            boolean underNew = false;

            private void all(List<PyvExpr> args) {
                for (PyvExpr a : args) {
                    visitThis(a);
                }
            }

            @Override
            public Void visit(PyvExpr.Bool e) {
                return null;
            }

            @Override
            public Void visit(PyvExpr.Id e) {
                if (underNew && globals.contains(e.getName())) {
                    res.add(e.getName());
                }
                return null;
            }

            @Override
            public Void visit(PyvExpr.UnaryExpr e) {
                if (e.getOp() == PyvExpr.UnaryExpr.Op.NEW) {
                    boolean saved = underNew;
                    underNew = true;
                    visitThis(e.getArg());
                    underNew = saved;
                } else {
                    visitThis(e.getArg());
                }
                return null;
            }

            @Override
            public Void visit(PyvExpr.BinaryExpr e) {
                visitThis(e.getArg1());
                visitThis(e.getArg2());
                return null;
            }

            @Override
            public Void visit(PyvExpr.NaryExpr e) {
                all(e.getArgs());
                return null;
            }

            @Override
            public Void visit(PyvExpr.AppExpr e) {
                all(e.getArgs());
                if (underNew && globals.contains(e.getCallee())) {
                    res.add(e.getCallee());
                }
                return null;
            }

            @Override
            public Void visit(PyvExpr.QuantifierExpr e) {
                visitThis(e.getBody());
                return null;
            }

            @Override
            public Void visit(PyvExpr.IfThenElse e) {
                visitThis(e.getBranch());
                visitThis(e.getThen());
                visitThis(e.getEls());
                return null;
            }
        }.visitThis(expr);
        return res;
    }

    private static List<Formula.Var> domainVars(Symbol sym) {
        List<Formula.Var> res = new ArrayList<>();
        if (sym.getSort() instanceof Sort.FunctionSort) {
            List<Sort> dom = ((Sort.FunctionSort) sym.getSort()).getDomain();
            for (int i = 0; i < dom.size(); i++) {
                res.add(Formula.var("X" + i, dom.get(i)));
            }
        }
        return res;
    }

    /**
     * {@code new(c) = c}, or {@code forall X0.. . new(r(X0..)) = r(X0..)}.
     */
    public static PyvExpr unchangedClause(Symbol sym) {
        List<Formula.Var> xs = domainVars(sym);
        List<Formula> args = new ArrayList<Formula>(xs);
        Formula eq = Formula.eq(Formula.app(sym.toNew(), args), Formula.app(sym, args));
        return translate(Formula.forall(xs, eq), true);
    }

    /**
     * {@code forall X0.. . exists V. new(f(X0..)) = V}: the post-state value
     * is arbitrary.
     */
    public static PyvExpr havocClause(Symbol sym) {
        List<Formula.Var> xs = domainVars(sym);
        Formula.Var v = Formula.var("V", sym.getRange());
        Formula ex = Formula.exists(Collections.singletonList(v),
                Formula.eq(Formula.app(sym.toNew(), new ArrayList<Formula>(xs)), v));
        return translate(Formula.forall(xs, ex), true);
    }

    private List<PyvExpr> all(List<Formula> terms) {
        List<PyvExpr> res = new ArrayList<>(terms.size());
        for (Formula t : terms) {
            res.add(visitThis(t));
        }
        return res;
    }

    @Override
    public PyvExpr visit(Formula.ForAll f) {
        return PyvExpr.forall(translateBinders(f.getVariables()), visitThis(f.getBody()));
    }

    @Override
    public PyvExpr visit(Formula.Exists f) {
        return PyvExpr.exists(translateBinders(f.getVariables()), visitThis(f.getBody()));
    }

    @Override
    public PyvExpr visit(Formula.Ite f) {
        return new PyvExpr.IfThenElse(visitThis(f.getCond()), visitThis(f.getThen()), visitThis(f.getElse()));
    }

    @Override
    public PyvExpr visit(Formula.And f) {
        if (f.getTerms().isEmpty()) {
            return PyvExpr.TRUE;
        }
        return PyvExpr.and(all(f.getTerms()));
    }

    @Override
    public PyvExpr visit(Formula.Or f) {
        if (f.getTerms().isEmpty()) {
            return PyvExpr.FALSE;
        }
        return PyvExpr.or(all(f.getTerms()));
    }

    @Override
    public PyvExpr visit(Formula.Eq f) {
        return PyvExpr.binary(PyvExpr.BinaryExpr.Op.EQUAL, visitThis(f.getT1()), visitThis(f.getT2()));
    }

    @Override
    public PyvExpr visit(Formula.Implies f) {
        return PyvExpr.binary(PyvExpr.BinaryExpr.Op.IMPLIES, visitThis(f.getT1()), visitThis(f.getT2()));
    }

    @Override
    public PyvExpr visit(Formula.Iff f) {
        return PyvExpr.binary(PyvExpr.BinaryExpr.Op.IFF, visitThis(f.getT1()), visitThis(f.getT2()));
    }

    @Override
    public PyvExpr visit(Formula.Not f) {
        return PyvExpr.not(visitThis(f.getBody()));
    }

    @Override
    public PyvExpr visit(Formula.Apply f) {
        Symbol func = f.getFunc();
        if (twoState && func.isNew()) {
            return PyvExpr.newOf(PyvExpr.app(NameTable.translateName(Naming.newOf(func.getName())), all(f.getArgs())));
        }
        return PyvExpr.app(NameTable.translateName(func.getName()), all(f.getArgs()));
    }

    @Override
    public PyvExpr visit(Formula.Const f) {
        if (twoState && f.getSymbol().isNew()) {
            return PyvExpr.newOf(PyvExpr.id(NameTable.translateName(Naming.newOf(f.getName()))));
        }
        return PyvExpr.id(NameTable.translateName(f.getName()));
    }

    @Override
    public PyvExpr visit(Formula.Var f) {
        return PyvExpr.id(NameTable.translateName(f.getName()));
    }
}
