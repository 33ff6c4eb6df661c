/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.logic;

import java.util.ArrayList;
import java.util.List;

/**
 * Visitor that rebuilds the formula bottom-up. Subclasses override the cases
 * they rewrite; every other node is rebuilt with the same shape.
 */
public class FormulaRewriter extends Formula.Visitor<Formula> {

    public Formula rewrite(Formula f) {
        return f.accept(this);
    }

    protected List<Formula> rewriteAll(List<Formula> terms) {
        List<Formula> res = new ArrayList<>(terms.size());
        for (Formula t : terms) {
            res.add(rewrite(t));
        }
        return res;
    }

    @Override
    public Formula visit(Formula.ForAll f) {
        return new Formula.ForAll(f.getVariables(), rewrite(f.getBody()));
    }

    @Override
    public Formula visit(Formula.Exists f) {
        return new Formula.Exists(f.getVariables(), rewrite(f.getBody()));
    }

    @Override
    public Formula visit(Formula.Ite f) {
        return new Formula.Ite(rewrite(f.getCond()), rewrite(f.getThen()), rewrite(f.getElse()));
    }

    @Override
    public Formula visit(Formula.And f) {
        return new Formula.And(rewriteAll(f.getTerms()));
    }

    @Override
    public Formula visit(Formula.Or f) {
        return new Formula.Or(rewriteAll(f.getTerms()));
    }

    @Override
    public Formula visit(Formula.Eq f) {
        return new Formula.Eq(rewrite(f.getT1()), rewrite(f.getT2()));
    }

    @Override
    public Formula visit(Formula.Implies f) {
        return new Formula.Implies(rewrite(f.getT1()), rewrite(f.getT2()));
    }

    @Override
    public Formula visit(Formula.Iff f) {
        return new Formula.Iff(rewrite(f.getT1()), rewrite(f.getT2()));
    }

    @Override
    public Formula visit(Formula.Not f) {
        return new Formula.Not(rewrite(f.getBody()));
    }

    @Override
    public Formula visit(Formula.Apply f) {
        return new Formula.Apply(f.getFunc(), rewriteAll(f.getArgs()));
    }

    @Override
    public Formula visit(Formula.Const f) {
        return f;
    }

    @Override
    public Formula visit(Formula.Var f) {
        return f;
    }
}
