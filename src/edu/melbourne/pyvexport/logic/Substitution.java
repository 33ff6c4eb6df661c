/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.logic;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Capture-avoiding substitution of variables, replacement of subformulas and
 * unfolding of definitions.
 */
public class Substitution extends FormulaRewriter {

    private final Map<Formula.Var, Formula> map;

    private Substitution(Map<Formula.Var, Formula> map) {
        this.map = map;
    }

    public static Formula substitute(Formula f, Map<Formula.Var, Formula> map) {
        if (map.isEmpty()) {
            return f;
        }
        return new Substitution(new HashMap<>(map)).rewrite(f);
    }

    /**
     * Variables occurring in {@code f} outside the scope of a binder for them.
     */
    public static Set<Formula.Var> freeVars(Formula f) {
        Set<Formula.Var> res = new LinkedHashSet<>();
        collectFreeVars(f, new HashSet<Formula.Var>(), res);
        return res;
    }

    private static void collectFreeVars(Formula f, Set<Formula.Var> bound, Set<Formula.Var> res) {
        if (f instanceof Formula.Var) {
            if (!bound.contains(f)) {
                res.add((Formula.Var) f);
            }
            return;
        }
        if (f instanceof Formula.Quantifier) {
            Set<Formula.Var> inner = new HashSet<>(bound);
            inner.addAll(((Formula.Quantifier) f).getVariables());
            collectFreeVars(((Formula.Quantifier) f).getBody(), inner, res);
            return;
        }
        for (Formula ch : f.children()) {
            collectFreeVars(ch, bound, res);
        }
    }

    /**
     * Replaces every subformula structurally equal to {@code target}.
     */
    public static Formula replace(Formula f, final Formula target, final Formula replacement) {
        return new FormulaRewriter() {
            @Override
            public Formula rewrite(Formula g) {
                if (g.equals(target)) {
                    return replacement;
                }
                return super.rewrite(g);
            }
        }.rewrite(f);
    }

    /**
     * Replaces every application {@code head(args)} with {@code body} where
     * {@code params} are instantiated by {@code args}.
     */
    public static Formula unfold(Formula f, final Symbol head, final List<Formula.Var> params, final Formula body) {
        if (head.getArity() != params.size()) {
            throw new IllegalArgumentException("definition of " + head + " has " + params.size() + " parameters");
        }
        return new FormulaRewriter() {
            @Override
            public Formula visit(Formula.Apply g) {
                List<Formula> args = rewriteAll(g.getArgs());
                if (!g.getFunc().equals(head)) {
                    return new Formula.Apply(g.getFunc(), args);
                }
                Map<Formula.Var, Formula> inst = new HashMap<>();
                for (int i = 0; i < params.size(); i++) {
                    inst.put(params.get(i), args.get(i));
                }
                return substitute(body, inst);
            }

            @Override
            public Formula visit(Formula.Const g) {
                if (params.isEmpty() && g.getSymbol().equals(head)) {
                    return body;
                }
                return g;
            }
        }.rewrite(f);
    }

    @Override
    public Formula visit(Formula.Var f) {
        Formula res = map.get(f);
        return res == null ? f : res;
    }

    @Override
    public Formula visit(Formula.ForAll f) {
        List<Formula.Var> vars = new ArrayList<>();
        Formula body = enter(f, vars);
        return new Formula.ForAll(vars, body);
    }

    @Override
    public Formula visit(Formula.Exists f) {
        List<Formula.Var> vars = new ArrayList<>();
        Formula body = enter(f, vars);
        return new Formula.Exists(vars, body);
    }

    // fills vars with the (possibly renamed) binders and returns the substituted body
    private Formula enter(Formula.Quantifier q, List<Formula.Var> vars) {
        Map<Formula.Var, Formula> inner = new HashMap<>(map);
        for (Formula.Var v : q.getVariables()) {
            inner.remove(v);
        }
        if (inner.isEmpty()) {
            vars.addAll(q.getVariables());
            return q.getBody();
        }
        Set<String> avoid = new HashSet<>();
        for (Formula val : inner.values()) {
            for (Formula.Var fv : freeVars(val)) {
                avoid.add(fv.getName());
            }
        }
        Set<String> taken = new HashSet<>(avoid);
        for (Formula.Var fv : freeVars(q.getBody())) {
            taken.add(fv.getName());
        }
        for (Formula.Var v : q.getVariables()) {
            taken.add(v.getName());
        }
        for (Formula.Var v : q.getVariables()) {
            if (!avoid.contains(v.getName())) {
                vars.add(v);
                continue;
            }
            String name = v.getName();
            int k = 1;
            while (taken.contains(name + k)) {
                k++;
            }
            Formula.Var fresh = new Formula.Var(name + k, v.getSort());
            taken.add(fresh.getName());
            inner.put(v, fresh);
            vars.add(fresh);
        }
        return new Substitution(inner).rewrite(q.getBody());
    }
}
