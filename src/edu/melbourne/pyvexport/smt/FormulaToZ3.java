/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.EnumSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import edu.melbourne.pyvexport.UnsupportedFormulaException;
import edu.melbourne.pyvexport.UnsupportedSortException;
import edu.melbourne.pyvexport.logic.Formula;
import edu.melbourne.pyvexport.logic.Sort;
import edu.melbourne.pyvexport.logic.Symbol;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles source formulas into Z3 expressions. Sorts and declarations are
 * created once per context and reused, so compiling the same formula twice
 * gives the same expression.
 * <p>
 * Quantified variables become bound constants named {@code name:sort}; the
 * sort suffix is what {@link Z3ToFormula} strips off again. A conjunction or
 * disjunction of one term compiles to the term.
 */
public class FormulaToZ3 extends Formula.Visitor<Expr> {

    private final Context ctx;
    private final Map<Sort, com.microsoft.z3.Sort> sorts = new HashMap<>();
    private final Map<Symbol, FuncDecl> decls = new HashMap<>();
    private final List<Formula.Var> bound = new ArrayList<>();

    public FormulaToZ3(Context ctx) {
        this.ctx = ctx;
    }

    public BoolExpr compile(Formula f) {
        if (f.getSort() != Sort.BOOL) {
            throw new UnsupportedFormulaException("not a formula: " + f, f);
        }
        bound.clear();
        return (BoolExpr) visitThis(f);
    }

    public com.microsoft.z3.Sort toSort(Sort s) {
        com.microsoft.z3.Sort res = sorts.get(s);
        if (res != null) {
            return res;
        }
        if (s == Sort.BOOL) {
            res = ctx.getBoolSort();
        } else if (s instanceof Sort.UninterpretedSort) {
            res = ctx.mkUninterpretedSort(s.getName());
        } else if (s instanceof Sort.EnumeratedSort) {
            List<String> values = ((Sort.EnumeratedSort) s).getValues();
            res = ctx.mkEnumSort(s.getName(), values.toArray(new String[values.size()]));
        } else {
            throw new UnsupportedSortException("no solver sort for " + s, s);
        }
        sorts.put(s, res);
        return res;
    }

    /**
     * Name of the solver sort of {@code s}, the key back-translation looks
     * sorts up by.
     */
    public String sortName(Sort s) {
        return toSort(s).getName().toString();
    }

    private FuncDecl toDecl(Symbol sym) {
        FuncDecl res = decls.get(sym);
        if (res != null) {
            return res;
        }
        Sort s = sym.getSort();
        if (s instanceof Sort.FunctionSort) {
            List<Sort> dom = ((Sort.FunctionSort) s).getDomain();
            com.microsoft.z3.Sort[] domain = new com.microsoft.z3.Sort[dom.size()];
            for (int i = 0; i < domain.length; i++) {
                domain[i] = toSort(dom.get(i));
            }
            res = ctx.mkFuncDecl(sym.getName(), domain, toSort(((Sort.FunctionSort) s).getRange()));
        } else {
            res = ctx.mkFuncDecl(sym.getName(), new com.microsoft.z3.Sort[0], toSort(s));
        }
        decls.put(sym, res);
        return res;
    }

    private Expr boundConst(Formula.Var v) {
        return ctx.mkConst(v.getName() + ":" + v.getSort().getName(), toSort(v.getSort()));
    }

    private Expr[] compileAll(List<Formula> terms) {
        Expr[] res = new Expr[terms.size()];
        for (int i = 0; i < res.length; i++) {
            res[i] = visitThis(terms.get(i));
        }
        return res;
    }

    private BoolExpr[] compileBools(List<Formula> terms) {
        BoolExpr[] res = new BoolExpr[terms.size()];
        for (int i = 0; i < res.length; i++) {
            res[i] = (BoolExpr) visitThis(terms.get(i));
        }
        return res;
    }

    private Expr[] enter(Formula.Quantifier f) {
        Expr[] consts = new Expr[f.getVariables().size()];
        for (int i = 0; i < consts.length; i++) {
            Formula.Var v = f.getVariables().get(i);
            if (!v.getSort().isFirstOrder()) {
                throw new UnsupportedSortException("quantified variable of sort " + v.getSort(), f);
            }
            consts[i] = boundConst(v);
        }
        bound.addAll(f.getVariables());
        return consts;
    }

    private void leave(Formula.Quantifier f) {
        for (int i = 0; i < f.getVariables().size(); i++) {
            bound.remove(bound.size() - 1);
        }
    }

    @Override
    public Expr visit(Formula.ForAll f) {
        Expr[] consts = enter(f);
        BoolExpr body = (BoolExpr) visitThis(f.getBody());
        leave(f);
        return ctx.mkForall(consts, body, 0, null, null, null, null);
    }

    @Override
    public Expr visit(Formula.Exists f) {
        Expr[] consts = enter(f);
        BoolExpr body = (BoolExpr) visitThis(f.getBody());
        leave(f);
        return ctx.mkExists(consts, body, 0, null, null, null, null);
    }

    @Override
    public Expr visit(Formula.Ite f) {
        return ctx.mkITE((BoolExpr) visitThis(f.getCond()), visitThis(f.getThen()), visitThis(f.getElse()));
    }

    @Override
    public Expr visit(Formula.And f) {
        if (f.getTerms().isEmpty()) {
            return ctx.mkTrue();
        }
        if (f.getTerms().size() == 1) {
            return visitThis(f.getTerms().get(0));
        }
        return ctx.mkAnd(compileBools(f.getTerms()));
    }

    @Override
    public Expr visit(Formula.Or f) {
        if (f.getTerms().isEmpty()) {
            return ctx.mkFalse();
        }
        if (f.getTerms().size() == 1) {
            return visitThis(f.getTerms().get(0));
        }
        return ctx.mkOr(compileBools(f.getTerms()));
    }

    @Override
    public Expr visit(Formula.Eq f) {
        return ctx.mkEq(visitThis(f.getT1()), visitThis(f.getT2()));
    }

    @Override
    public Expr visit(Formula.Implies f) {
        return ctx.mkImplies((BoolExpr) visitThis(f.getT1()), (BoolExpr) visitThis(f.getT2()));
    }

    @Override
    public Expr visit(Formula.Iff f) {
        return ctx.mkIff((BoolExpr) visitThis(f.getT1()), (BoolExpr) visitThis(f.getT2()));
    }

    @Override
    public Expr visit(Formula.Not f) {
        return ctx.mkNot((BoolExpr) visitThis(f.getBody()));
    }

    @Override
    public Expr visit(Formula.Apply f) {
        return ctx.mkApp(toDecl(f.getFunc()), compileAll(f.getArgs()));
    }

    @Override
    public Expr visit(Formula.Const f) {
        Symbol sym = f.getSymbol();
        if (sym.getSort() instanceof Sort.EnumeratedSort) {
            Sort.EnumeratedSort es = (Sort.EnumeratedSort) sym.getSort();
            int idx = es.getValues().indexOf(sym.getName());
            if (idx >= 0) {
                return ((EnumSort) toSort(es)).getConst(idx);
            }
        }
        if (sym.getSort() instanceof Sort.FunctionSort) {
            throw new UnsupportedFormulaException("unapplied symbol " + sym, f);
        }
        return ctx.mkApp(toDecl(sym));
    }

    @Override
    public Expr visit(Formula.Var f) {
        if (!bound.contains(f)) {
            throw new UnsupportedFormulaException("free variable " + f.getName(), f);
        }
        return boundConst(f);
    }
}
