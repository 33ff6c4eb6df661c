/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.logic;

/**
 * Rebuilds a formula through the {@link Formula} factories. The elaborator
 * builds nodes directly, so its output may hold one-element conjunctions,
 * quantifiers without binders or equations between Boolean terms; Z3 never
 * gives those back.
 */
public class Canonicalizer extends FormulaRewriter {

    private static final Canonicalizer INSTANCE = new Canonicalizer();

    public static Formula canonical(Formula f) {
        return INSTANCE.rewrite(f);
    }

    @Override
    public Formula visit(Formula.ForAll f) {
        return Formula.forall(f.getVariables(), rewrite(f.getBody()));
    }

    @Override
    public Formula visit(Formula.Exists f) {
        return Formula.exists(f.getVariables(), rewrite(f.getBody()));
    }

    @Override
    public Formula visit(Formula.And f) {
        return Formula.and(rewriteAll(f.getTerms()));
    }

    @Override
    public Formula visit(Formula.Or f) {
        return Formula.or(rewriteAll(f.getTerms()));
    }

    @Override
    public Formula visit(Formula.Eq f) {
        return Formula.eq(rewrite(f.getT1()), rewrite(f.getT2()));
    }
}
