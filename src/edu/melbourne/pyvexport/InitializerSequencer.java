/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import edu.melbourne.pyvexport.logic.Action;
import edu.melbourne.pyvexport.logic.Canonicalizer;
import edu.melbourne.pyvexport.logic.Formula;
import edu.melbourne.pyvexport.logic.SourceModule;
import edu.melbourne.pyvexport.mypyvy.Decl;
import edu.melbourne.pyvexport.mypyvy.PyvExpr;
import edu.melbourne.pyvexport.smt.Z3ToFormula;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Builds the single mypyvy initializer. Initializers cannot be translated one
 * by one since a later one observes the state left by the earlier ones, so
 * they are composed in sequence and translated as one action. Its first-order
 * witnesses are bound by an existential around the one-state formula.
 */
public class InitializerSequencer {

    private static final Logger logger = Logger.getLogger(InitializerSequencer.class);

    private static final Formula MUST_NOT_FAIL = Formula.not(Formula.TRUE);

    private final ExportContext context;

    public InitializerSequencer(ExportContext context) {
        this.context = context;
    }

    public ActionTranslation<Decl.InitDecl> translateInitializers(List<Action> initializers) {
        logger.info("Translating initializer...");
        long start = System.currentTimeMillis();
        SourceModule module = context.getModule();
        Formula upd = Canonicalizer.canonical(stripMustNotFail(module.makeVc(module.sequence(initializers))));

        Z3ToFormula back = context.backTranslation(upd);
        Formula simplified = back.translate(context.getEliminator().simplify(context.getCompiler().compile(upd), back));
        logger.debug("simplified initializer: " + simplified);

        Witnesses ws = Witnesses.of(simplified);
        PyvExpr fmla = PyvExpr.exists(LogicToPyv.translateParams(ws.getFirstOrder(), context.getNames().scope()), LogicToPyv.translate(simplified));
        Decl.InitDecl decl = new Decl.InitDecl(null, fmla);
        logger.info(TransitionBuilder.sizeReport(start, simplified, upd));
        return new ActionTranslation<>(decl, ws.getSecondOrder());
    }

    /**
     * The verification condition ends with the conjunct {@code ~true}; the
     * rest is the initial-state formula.
     */
    static Formula stripMustNotFail(Formula vc) {
        if (!(vc instanceof Formula.And)) {
            throw new IllegalStateException("verification condition is not a conjunction: " + vc);
        }
        List<Formula> terms = ((Formula.And) vc).getTerms();
        if (terms.isEmpty() || !terms.get(terms.size() - 1).equals(MUST_NOT_FAIL)) {
            throw new IllegalStateException("verification condition does not end with " + MUST_NOT_FAIL + ": " + vc);
        }
        return new Formula.And(terms.subList(0, terms.size() - 1));
    }
}
