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
import edu.melbourne.pyvexport.logic.Sort;
import edu.melbourne.pyvexport.logic.Symbol;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class MacroEliminatorTest {

    private final Sort node = Sort.uninterpreted("node");
    private final Symbol r = new Symbol("r", Sort.relation(node));
    private final Symbol newR = r.toNew();
    private final Symbol m = new Symbol("__m_r", Sort.relation(node));
    private final Symbol c = new Symbol("c", node);
    private final Symbol p = new Symbol("p", Sort.BOOL);
    private final Formula.Var x = Formula.var("X", node);
    private final Formula.Var y = Formula.var("Y", node);

    private SmtSession session;
    private Context ctx;
    private FormulaToZ3 compiler;
    private Z3ToFormula back;

    @Before
    public void setUp() {
        session = new SmtSession(0);
        ctx = session.getContext();
        compiler = new FormulaToZ3(ctx);
        Map<String, Sort> sorts = new HashMap<>();
        sorts.put(compiler.sortName(Sort.BOOL), Sort.BOOL);
        sorts.put(compiler.sortName(node), node);
        Map<String, Symbol> symbols = new HashMap<>();
        for (Symbol s : Arrays.asList(r, newR, m, c, p)) {
            symbols.put(s.getName(), s);
        }
        back = new Z3ToFormula(sorts, symbols);
    }

    @After
    public void tearDown() {
        session.close();
    }

    private Formula definition() {
        // forall X. __m_r(X) <-> (r(X) | X = c)
        return Formula.forall(Arrays.asList(x),
                Formula.iff(Formula.app(m, x), Formula.or(Formula.app(r, x), Formula.eq(x, Formula.cnst(c)))));
    }

    private Formula transition() {
        // forall Y. new_r(Y) <-> (__m_r(Y) | p)
        return Formula.forall(Arrays.asList(y),
                Formula.iff(Formula.app(newR, y), Formula.or(Formula.app(m, y), Formula.cnst(p))));
    }

    private void assertEquivalent(Formula expected, BoolExpr actual) {
        assertEquals(Status.UNSATISFIABLE, session.check(ctx.mkXor(compiler.compile(expected), actual)));
    }

    @Test
    public void eliminatesTemporaryRelation() {
        MacroEliminator elim = new MacroEliminator(session, compiler, true, false);
        BoolExpr res = elim.simplify(compiler.compile(Formula.and(definition(), transition())), back);
        Formula f = back.translate(res);
        assertFalse(f.symbols().contains(m));
        assertTrue(f.symbols().contains(newR));
        Formula expected = Formula.forall(Arrays.asList(y),
                Formula.iff(Formula.app(newR, y), Formula.or(Formula.or(Formula.app(r, y), Formula.eq(y, Formula.cnst(c))), Formula.cnst(p))));
        assertEquivalent(expected, res);
    }

    @Test
    public void eliminatesWithSimplification() {
        MacroEliminator elim = new MacroEliminator(session, compiler, true, true);
        Formula input = Formula.and(Formula.cnst(p), definition(), transition(), Formula.cnst(p));
        BoolExpr res = elim.simplify(compiler.compile(input), back);
        assertFalse(back.translate(res).symbols().contains(m));
        Formula expected = Formula.and(Formula.cnst(p), Formula.forall(Arrays.asList(y),
                Formula.iff(Formula.app(newR, y), Formula.or(Formula.or(Formula.app(r, y), Formula.eq(y, Formula.cnst(c))), Formula.cnst(p)))));
        assertEquivalent(expected, res);
    }

    @Test
    public void leavesFormulaWithoutMacrosAlone() {
        MacroEliminator elim = new MacroEliminator(session, compiler, true, false);
        BoolExpr e = compiler.compile(transition());
        assertSame(e, elim.simplify(e, back));
    }

    @Test
    public void findsDefinitionAmongConjuncts() {
        MacroEliminator elim = new MacroEliminator(session, compiler, true, false);
        BoolExpr e = compiler.compile(Formula.and(transition(), definition()));
        MacroEliminator.Macro found = elim.findMacro(e, back);
        assertNotNull(found);
        assertEquals(m, found.head);
        assertEquals(Arrays.asList(x), found.params);
        assertEquals(Formula.or(Formula.app(r, x), Formula.eq(x, Formula.cnst(c))), found.body);
    }

    @Test
    public void subtermsAreListedBottomUp() {
        BoolExpr e = compiler.compile(Formula.and(Formula.cnst(p), Formula.not(Formula.cnst(p))));
        List<Expr> subs = new ArrayList<>(MacroEliminator.subterms(e));
        assertEquals(3, subs.size());
        assertEquals(e, subs.get(2));
        assertTrue(subs.get(0).isConst());
    }

    @Test
    public void parsesDefinitionWithHeadOnEitherSide() {
        Formula body = Formula.and(Formula.app(r, x), Formula.not(Formula.eq(x, Formula.cnst(c))));
        Formula left = Formula.forall(Arrays.asList(x), Formula.iff(Formula.app(m, x), body));
        Formula right = Formula.forall(Arrays.asList(x), Formula.iff(body, Formula.app(m, x)));
        assertEquals(body, MacroEliminator.parseMacro(null, left).body);
        assertEquals(body, MacroEliminator.parseMacro(null, right).body);
        assertEquals(m, MacroEliminator.parseMacro(null, right).head);
    }

    @Test
    public void rejectsNonDefinitions() {
        Formula body = Formula.app(r, x);
        // not quantified
        assertNull(MacroEliminator.parseMacro(null, Formula.iff(Formula.app(m, Formula.cnst(c)), Formula.cnst(p))));
        // not an equivalence
        assertNull(MacroEliminator.parseMacro(null, Formula.forall(Arrays.asList(x),
                Formula.implies(Formula.app(m, x), body))));
        // ordinary relation
        assertNull(MacroEliminator.parseMacro(null, Formula.forall(Arrays.asList(x),
                Formula.iff(Formula.app(newR, x), body))));
        // applied to a constant
        assertNull(MacroEliminator.parseMacro(null, Formula.forall(Arrays.asList(x),
                Formula.iff(Formula.app(m, Formula.cnst(c)), body))));
        // recursive
        assertNull(MacroEliminator.parseMacro(null, Formula.forall(Arrays.asList(x),
                Formula.iff(Formula.app(m, x), Formula.not(Formula.app(m, x))))));
        // existential
        assertNull(MacroEliminator.parseMacro(null, Formula.exists(Arrays.asList(x),
                Formula.iff(Formula.app(m, x), body))));
    }

    @Test
    public void rejectsRepeatedParameters() {
        Symbol m2 = new Symbol("__m_e", Sort.relation(node, node));
        Formula f = new Formula.ForAll(Arrays.asList(x, x), Formula.iff(Formula.app(m2, x, x), Formula.cnst(p)));
        assertNull(MacroEliminator.parseMacro(null, f));
    }

    @Test(expected = SimplificationUnsoundException.class)
    public void resultNotImpliedByOriginalIsUnsound() {
        MacroEliminator elim = new MacroEliminator(session, compiler, true, false);
        BoolExpr original = compiler.compile(Formula.cnst(p));
        elim.checkSound(original, ctx.mkNot(original), new ArrayList<MacroEliminator.Macro>(), back);
    }

    @Test(expected = SimplificationUnsoundException.class)
    public void droppingMoreThanTheDefinitionIsUnsound() {
        MacroEliminator elim = new MacroEliminator(session, compiler, true, false);
        BoolExpr original = compiler.compile(Formula.and(definition(), transition()));
        MacroEliminator.Macro found = elim.findMacro(original, back);
        assertNotNull(found);
        // implied by the original, but the transition is lost
        elim.checkSound(original, ctx.mkTrue(), Arrays.asList(found), back);
    }
}
