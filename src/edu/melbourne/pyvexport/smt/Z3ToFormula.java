/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.smt;

import com.microsoft.z3.Expr;
import com.microsoft.z3.Quantifier;
import com.microsoft.z3.enumerations.Z3_decl_kind;
import edu.melbourne.pyvexport.UnresolvedSymbolException;
import edu.melbourne.pyvexport.UnsupportedFormulaException;
import edu.melbourne.pyvexport.UnsupportedSortException;
import edu.melbourne.pyvexport.logic.Formula;
import edu.melbourne.pyvexport.logic.Sort;
import edu.melbourne.pyvexport.logic.Symbol;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reads Z3 expressions back as source formulas.
 * <p>
 * Z3 refers to quantified variables by de Bruijn index. The translation keeps
 * the binders of the enclosing quantifiers on a stack, innermost first, so
 * that index {@code i} is the {@code i}-th entry. Nodes are rebuilt with the
 * constructors of {@link Formula}, never the simplifying factories, so that
 * compiling a canonical formula and reading it back gives an equal formula.
 */
public class Z3ToFormula {

    private final Map<String, Sort> sorts;
    private final Map<String, Symbol> symbols;

    /**
     * @param sorts source sorts by solver sort name
     * @param symbols source symbols by name
     */
    public Z3ToFormula(Map<String, Sort> sorts, Map<String, Symbol> symbols) {
        this.sorts = sorts;
        this.symbols = symbols;
    }

    public Formula translate(Expr e) {
        return translate(e, Collections.<Formula.Var>emptyList());
    }

    /**
     * Drops the sort suffix Z3 bound variable names carry ({@code X:node}).
     */
    public static String binderName(String name) {
        int idx = name.lastIndexOf(':');
        return idx < 0 ? name : name.substring(0, idx);
    }

    private Sort lookupSort(com.microsoft.z3.Sort s, Expr e) {
        Sort res = sorts.get(s.getName().toString());
        if (res == null) {
            throw new UnsupportedSortException("unknown solver sort " + s, e);
        }
        return res;
    }

    private List<Formula.Var> binders(Quantifier q) {
        com.microsoft.z3.Symbol[] names = q.getBoundVariableNames();
        com.microsoft.z3.Sort[] srts = q.getBoundVariableSorts();
        List<Formula.Var> res = new ArrayList<>(names.length);
        for (int i = 0; i < names.length; i++) {
            res.add(new Formula.Var(binderName(names[i].toString()), lookupSort(srts[i], q)));
        }
        return res;
    }

    private List<Formula> translateAll(Expr[] args, List<Formula.Var> stack) {
        List<Formula> res = new ArrayList<>(args.length);
        for (Expr a : args) {
            res.add(translate(a, stack));
        }
        return res;
    }

    private Symbol lookupSymbol(Expr e) {
        String name = e.getFuncDecl().getName().toString();
        Symbol sym = symbols.get(name);
        if (sym == null) {
            throw new UnresolvedSymbolException("no symbol named " + name, e);
        }
        return sym;
    }

    private Formula translate(Expr e, List<Formula.Var> stack) {
        if (e.isQuantifier()) {
            Quantifier q = (Quantifier) e;
            List<Formula.Var> vars = binders(q);
            List<Formula.Var> inner = new ArrayList<>(vars);
            Collections.reverse(inner);
            inner.addAll(stack);
            Formula body = translate(q.getBody(), inner);
            if (q.isUniversal()) {
                return new Formula.ForAll(vars, body);
            }
            if (q.isExistential()) {
                return new Formula.Exists(vars, body);
            }
            throw new UnsupportedFormulaException("unsupported binder " + e, e);
        }
        if (e.isVar()) {
            int idx = e.getIndex();
            if (idx >= stack.size()) {
                throw new UnsupportedFormulaException("loose bound variable " + e, e);
            }
            return stack.get(idx);
        }
        if (e.isTrue()) {
            return Formula.TRUE;
        }
        if (e.isFalse()) {
            return Formula.FALSE;
        }
        Expr[] args = e.getArgs();
        if (e.isNot()) {
            return new Formula.Not(translate(args[0], stack));
        }
        if (e.isAnd()) {
            return new Formula.And(translateAll(args, stack));
        }
        if (e.isOr()) {
            return new Formula.Or(translateAll(args, stack));
        }
        if (e.isImplies()) {
            return new Formula.Implies(translate(args[0], stack), translate(args[1], stack));
        }
        if (e.isIff() || (e.isEq() && args[0].isBool())) {
            return new Formula.Iff(translate(args[0], stack), translate(args[1], stack));
        }
        if (e.isEq()) {
            return new Formula.Eq(translate(args[0], stack), translate(args[1], stack));
        }
        if (e.isITE()) {
            return new Formula.Ite(translate(args[0], stack), translate(args[1], stack), translate(args[2], stack));
        }
        if (e.isXor()) {
            return new Formula.Not(new Formula.Iff(translate(args[0], stack), translate(args[1], stack)));
        }
        if (e.isDistinct()) {
            List<Formula> terms = translateAll(args, stack);
            List<Formula> diseqs = new ArrayList<>();
            for (int i = 0; i < terms.size(); i++) {
                for (int j = i + 1; j < terms.size(); j++) {
                    diseqs.add(Formula.not(Formula.eq(terms.get(i), terms.get(j))));
                }
            }
            return Formula.and(diseqs);
        }
        if (e.isConst()) {
            return new Formula.Const(lookupSymbol(e));
        }
        if (e.isApp() && e.getFuncDecl().getDeclKind() == Z3_decl_kind.Z3_OP_UNINTERPRETED) {
            return new Formula.Apply(lookupSymbol(e), translateAll(args, stack));
        }
        throw new UnsupportedFormulaException("unhandled SMT formula: " + e, e);
    }
}
