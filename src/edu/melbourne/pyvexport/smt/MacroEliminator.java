/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Status;
import edu.melbourne.pyvexport.SimplificationUnsoundException;
import edu.melbourne.pyvexport.logic.Formula;
import edu.melbourne.pyvexport.logic.Naming;
import edu.melbourne.pyvexport.logic.Substitution;
import edu.melbourne.pyvexport.logic.Symbol;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.log4j.Logger;

/**
 * Removes the temporary relations ({@code __m_} prefix) the elaborator
 * introduces to abbreviate subformulas, then runs the generic Z3
 * simplifications on the result.
 * <p>
 * A temporary relation is eliminated when the formula contains its
 * definition {@code forall X1..Xn. __m_r(X1..Xn) <-> body}: the definition
 * is replaced by {@code true} and every other application of the head is
 * unfolded into the body. This is repeated until no definition is left.
 */
public class MacroEliminator {

    private static final Logger logger = Logger.getLogger(MacroEliminator.class);

    public static final String MACRO_FINDER = "macro-finder";
    public static final String CTX_SOLVER_SIMPLIFY = "ctx-solver-simplify";
    public static final String PROPAGATE_VALUES = "propagate-values";

    private final SmtSession session;
    private final FormulaToZ3 compiler;
    private final boolean checkEquivalence;
    private final boolean simplify;

    public MacroEliminator(SmtSession session, FormulaToZ3 compiler, boolean checkEquivalence, boolean simplify) {
        this.session = session;
        this.compiler = compiler;
        this.checkEquivalence = checkEquivalence;
        this.simplify = simplify;
    }

    /**
     * A definition found in the formula: {@code head(params) = body}.
     */
    static class Macro {

        final Expr definition;
        final Symbol head;
        final List<Formula.Var> params;
        final Formula body;

        Macro(Expr definition, Symbol head, List<Formula.Var> params, Formula body) {
            this.definition = definition;
            this.head = head;
            this.params = params;
            this.body = body;
        }

        @Override
        public String toString() {
            return definition.toString();
        }
    }

    /**
     * @param fmla formula over the symbols {@code back} resolves
     * @return an equivalent formula with no temporary relation definitions
     */
    public BoolExpr simplify(BoolExpr fmla, Z3ToFormula back) {
        Context ctx = session.getContext();
        BoolExpr current = fmla;
        List<Macro> eliminated = new ArrayList<>();
        while (true) {
            Macro m = findMacro(current, back);
            if (m == null) {
                break;
            }
            logger.debug("eliminating macro " + m);
            BoolExpr withoutDefinition = (BoolExpr) current.substitute(m.definition, ctx.mkTrue());
            Formula unfolded = Substitution.unfold(back.translate(withoutDefinition), m.head, m.params, m.body);
            current = compiler.compile(unfolded);
            logger.debug("after elimination: " + unfolded);
            eliminated.add(m);
        }
        if (!eliminated.isEmpty() && checkEquivalence) {
            checkSound(fmla, current, eliminated, back);
        }
        if (simplify) {
            current = session.applyTactic(CTX_SOLVER_SIMPLIFY, current);
            current = session.applyTactic(PROPAGATE_VALUES, current);
        }
        return current;
    }

    /**
     * Subterms of {@code e} reachable through applications, smaller ones
     * first, each once. The walk does not enter quantifiers.
     */
    static Set<Expr> subterms(Expr e) {
        Set<Expr> res = new LinkedHashSet<>();
        collect(e, res);
        return res;
    }

    private static void collect(Expr e, Set<Expr> res) {
        if (res.contains(e)) {
            return;
        }
        if (e.isApp()) {
            for (Expr ch : e.getArgs()) {
                collect(ch, res);
            }
        }
        res.add(e);
    }

    Macro findMacro(BoolExpr fmla, Z3ToFormula back) {
        for (Expr t : subterms(fmla)) {
            if (!t.isQuantifier()) {
                continue;
            }
            Macro m = parseMacro(t, back.translate(t));
            if (m == null) {
                continue;
            }
            // agree with Z3 on what a macro is
            if (!session.applyTactic(MACRO_FINDER, (BoolExpr) t).isTrue()) {
                logger.debug(MACRO_FINDER + " does not accept " + t);
                continue;
            }
            return m;
        }
        return null;
    }

    /**
     * Null unless {@code f} is a universally quantified equivalence or
     * equation with a temporary relation applied to exactly the quantified
     * variables, in order, on one side and no occurrence of it on the other.
     */
    static Macro parseMacro(Expr definition, Formula f) {
        if (!(f instanceof Formula.ForAll)) {
            return null;
        }
        Formula.ForAll q = (Formula.ForAll) f;
        Formula body = q.getBody();
        if (!(body instanceof Formula.Iff || body instanceof Formula.Eq)) {
            return null;
        }
        List<Formula> sides = body.children();
        List<Formula> vars = new ArrayList<Formula>(q.getVariables());
        for (int side = 0; side < 2; side++) {
            Formula head = sides.get(side);
            Formula other = sides.get(1 - side);
            if (!(head instanceof Formula.Apply)) {
                continue;
            }
            Formula.Apply app = (Formula.Apply) head;
            if (!Naming.isTemporary(app.getFunc().getName()) || !app.getArgs().equals(vars)) {
                continue;
            }
            if (new LinkedHashSet<>(vars).size() != vars.size() || other.symbols().contains(app.getFunc())) {
                continue;
            }
            return new Macro(definition, app.getFunc(), q.getVariables(), other);
        }
        return null;
    }

    /**
     * The eliminated heads are existential witnesses, so the result is not
     * equivalent to the original as a formula over the heads. Instead the
     * original must imply the result, and the original with the heads
     * replaced by their definitions must be equivalent to it.
     */
    void checkSound(BoolExpr original, BoolExpr result, List<Macro> eliminated, Z3ToFormula back) {
        Context ctx = session.getContext();
        Status st = session.check(ctx.mkAnd(original, ctx.mkNot(result)));
        if (st == Status.SATISFIABLE) {
            throw new SimplificationUnsoundException("macro elimination produced a formula not implied by the original: "
                    + original + "\ndoes not imply\n" + result, result);
        }
        Formula unfolded = back.translate(original);
        for (Macro m : eliminated) {
            unfolded = Substitution.unfold(unfolded, m.head, m.params, m.body);
        }
        st = session.check(ctx.mkXor(compiler.compile(unfolded), result));
        if (st == Status.SATISFIABLE) {
            throw new SimplificationUnsoundException("macro elimination produced a non-equivalent formula: "
                    + unfolded + "\nis not equivalent to\n" + result, result);
        }
    }
}
