/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import com.microsoft.z3.BoolExpr;
import edu.melbourne.pyvexport.logic.Action;
import edu.melbourne.pyvexport.logic.ActionUpdate;
import edu.melbourne.pyvexport.logic.Canonicalizer;
import edu.melbourne.pyvexport.logic.Formula;
import edu.melbourne.pyvexport.logic.Naming;
import edu.melbourne.pyvexport.logic.Symbol;
import edu.melbourne.pyvexport.mypyvy.Decl;
import edu.melbourne.pyvexport.mypyvy.PyvExpr;
import edu.melbourne.pyvexport.smt.Z3ToFormula;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import org.apache.log4j.Logger;

/**
 * Turns a public action into a mypyvy transition.
 * <p>
 * The formula is the action's transition relation conjoined with the negated
 * failure condition. It is simplified through Z3, its first-order witnesses
 * become parameters, and the modifies clause is recomputed the way mypyvy
 * computes it. Symbols mypyvy would consider modified but that the
 * simplified formula leaves alone get an explicit unchanged clause.
 */
public class TransitionBuilder {

    private static final Logger logger = Logger.getLogger(TransitionBuilder.class);

    private final ExportContext context;

    public TransitionBuilder(ExportContext context) {
        this.context = context;
    }

    public ActionTranslation<Decl.DefinitionDecl> translateAction(String name, Action action) {
        logger.info("Translating action `" + name + "`...");
        long start = System.currentTimeMillis();
        ActionUpdate upd = action.update();

        // the precondition holds when the action fails
        Formula fmla = Canonicalizer.canonical(
                new Formula.And(Arrays.asList(Formula.not(upd.getPrecondition()), upd.getTransition())));
        Z3ToFormula back = context.backTranslation(fmla);

        BoolExpr z3Fmla = context.getCompiler().compile(fmla);
        Formula roundTrip = back.translate(z3Fmla);
        if (!roundTrip.equals(fmla)) {
            throw new RoundTripException("Round-tripping Ivy -> SMT -> Ivy is incorrect: BEFORE:\n" + fmla
                    + "\n!=\nAFTER:\n" + roundTrip, fmla);
        }

        Formula simplified = back.translate(context.getEliminator().simplify(z3Fmla, back));
        logger.debug("simplified `" + name + "`: " + simplified);

        Witnesses ws = Witnesses.of(simplified);
        PyvExpr body = LogicToPyv.translate(simplified, true);

        Set<String> supposedlyModified = new TreeSet<>(LogicToPyv.globalsUnderNew(context.getMutableNames(), body));
        Set<String> actuallyModified = new TreeSet<>();
        for (Symbol s : simplified.symbols()) {
            if (s.isNew()) {
                actuallyModified.add(NameTable.translateName(Naming.newOf(s.getName())));
            }
        }
        Set<String> origModified = new TreeSet<>();
        for (Symbol s : upd.getModified()) {
            origModified.add(NameTable.translateName(s.getName()));
        }
        logger.debug("supposedly modified: " + supposedlyModified + ", actually modified: " + actuallyModified);
        if (!origModified.equals(actuallyModified)) {
            throw new ModifiesMismatchException("modified symbols of `" + name + "` changed: " + origModified
                    + " != " + actuallyModified, simplified);
        }

        List<PyvExpr> unchanged = new ArrayList<>();
        for (String s : supposedlyModified) {
            if (!actuallyModified.contains(s)) {
                PyvExpr clause = LogicToPyv.unchangedClause(context.mutableSymbol(s));
                logger.debug("unchanged clause: " + clause);
                unchanged.add(clause);
            }
        }
        if (!unchanged.isEmpty()) {
            body = PyvExpr.and(body, PyvExpr.and(unchanged));
        }

        String pyvName = context.getNames().register(name);
        Decl.DefinitionDecl decl = new Decl.DefinitionDecl(pyvName,
                LogicToPyv.translateParams(ws.getFirstOrder(), context.getNames().scope()),
                new ArrayList<>(supposedlyModified), body);
        logger.info(sizeReport(start, simplified, fmla));
        return new ActionTranslation<>(decl, ws.getSecondOrder());
    }

    /**
     * {@code done in 0.42s! (37.5% of original size)}, size being the
     * printed length.
     */
    static String sizeReport(long start, Formula simplified, Formula original) {
        double secs = (System.currentTimeMillis() - start) / 1000.0;
        double pct = 100.0 * simplified.toString().length() / original.toString().length();
        return String.format(Locale.ROOT, "done in %.2fs! (%.1f%% of original size)", secs, pct);
    }
}
