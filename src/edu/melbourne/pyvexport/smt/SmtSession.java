/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.smt;

import com.microsoft.z3.ApplyResult;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Goal;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Tactic;
import com.microsoft.z3.Z3Exception;
import edu.melbourne.pyvexport.SolverTimeoutException;
import edu.melbourne.pyvexport.TranslationException;
import java.util.HashMap;
import org.apache.log4j.Logger;

/**
 * Owns the Z3 context of a translation run and wraps the calls into the
 * solver that can take unbounded time: tactic applications and
 * satisfiability checks. Both honour the per-call budget.
 */
public class SmtSession implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(SmtSession.class);

    private final Context ctx;
    private final int timeoutMs;

    public SmtSession(int timeoutMs) {
        HashMap<String, String> cfg = new HashMap<>();
        cfg.put("model", "false");
        //cfg.put("proof", "true");
        this.ctx = new Context(cfg);
        this.timeoutMs = timeoutMs;
    }

    public Context getContext() {
        return ctx;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    /**
     * Applies the named tactic to {@code e} and returns the disjunction of the
     * resulting subgoals.
     */
    public BoolExpr applyTactic(String name, BoolExpr e) {
        Goal g = ctx.mkGoal(false, false, false);//mkGoal(model, unsatcore, proofs)
        g.add(e);
        Tactic t = ctx.mkTactic(name);
        if (timeoutMs > 0) {
            t = ctx.tryFor(t, timeoutMs);
        }
        ApplyResult ar;
        try {
            ar = t.apply(g);
        } catch (Z3Exception ex) {
            throw failure("tactic " + name, e, ex);
        }
        Goal[] g1 = ar.getSubgoals();
        if (g1.length == 1) {
            return g1[0].AsBoolExpr();
        }
        BoolExpr be = ctx.mkFalse();
        if (g1.length > 1) {
            be = g1[0].AsBoolExpr();
        }
        for (int i = 1; i < g1.length; i++) {
            be = ctx.mkOr(be, g1[i].AsBoolExpr());
        }
        return be;
    }

    /**
     * Satisfiability of {@code e}. An UNKNOWN caused by the time budget
     * raises {@link SolverTimeoutException}; any other UNKNOWN is returned
     * to the caller.
     */
    public Status check(BoolExpr e) {
        Solver s = ctx.mkSolver();
        if (timeoutMs > 0) {
            Params p = ctx.mkParams();
            p.add("timeout", timeoutMs);
            s.setParameters(p);
        }
        s.add(e);
        Status st;
        try {
            st = s.check();
        } catch (Z3Exception ex) {
            throw failure("satisfiability check", e, ex);
        }
        if (st == Status.UNKNOWN) {
            String reason = s.getReasonUnknown();
            if (isTimeout(reason)) {
                throw new SolverTimeoutException("satisfiability check ran out of time (" + timeoutMs + " ms)", e);
            }
            logger.warn("solver returned unknown status: " + reason);
        }
        return st;
    }

    private TranslationException failure(String what, BoolExpr e, Z3Exception ex) {
        if (isTimeout(ex.getMessage())) {
            return new SolverTimeoutException(what + " ran out of time (" + timeoutMs + " ms)", e, ex);
        }
        return new TranslationException("Z3 error in " + what + ": " + ex.getMessage(), e, ex);
    }

    private static boolean isTimeout(String reason) {
        return reason != null && (reason.contains("timeout") || reason.contains("canceled"));
    }

    @Override
    public void close() {
        ctx.close();
    }
}
