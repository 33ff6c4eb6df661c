/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import edu.melbourne.pyvexport.logic.Formula;
import edu.melbourne.pyvexport.logic.Sort;
import edu.melbourne.pyvexport.logic.Symbol;
import edu.melbourne.pyvexport.mypyvy.PyvExpr;
import edu.melbourne.pyvexport.mypyvy.PyvSort;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import org.junit.Test;

import static org.junit.Assert.*;

public class LogicToPyvTest {

    private final Sort node = Sort.uninterpreted("node");
    private final Symbol edge = new Symbol("edge", Sort.relation(node, node));
    private final Symbol owner = new Symbol("owner", Sort.relation(node));
    private final Symbol c = new Symbol("c", node);
    private final Symbol f = new Symbol("f", Sort.function(node, node));
    private final Formula.Var x = Formula.var("X", node);

    @Test
    public void sorts() {
        assertSame(PyvSort.BOOL, LogicToPyv.translateSort(Sort.BOOL));
        assertEquals(PyvSort.uninterpreted("node"), LogicToPyv.translateSort(node));
        assertEquals(PyvSort.uninterpreted("color"), LogicToPyv.translateSort(Sort.enumerated("color", "red", "green")));
    }

    @Test(expected = UnsupportedSortException.class)
    public void functionSortIsNotAVariableSort() {
        LogicToPyv.translateSort(Sort.relation(node));
    }

    @Test
    public void symbolDeclarations() {
        assertEquals("mutable relation edge(node, node)", LogicToPyv.translateSymbolDecl(edge, true).toString());
        assertEquals("immutable constant c: node", LogicToPyv.translateSymbolDecl(c, false).toString());
        assertEquals("immutable function f(node): node", LogicToPyv.translateSymbolDecl(f, false).toString());
        Symbol indexed = new Symbol("m.flag[0]", Sort.BOOL);
        assertEquals("mutable constant m_flag_B_0_B_: bool", LogicToPyv.translateSymbolDecl(indexed, true).toString());
    }

    @Test
    public void oneStateFormula() {
        Formula fml = Formula.forall(Arrays.asList(x),
                Formula.implies(Formula.app(owner, x), Formula.not(Formula.eq(Formula.app(f, x), Formula.cnst(c)))));
        assertEquals("forall X:node. owner(X) -> (!(f(X) = c))", LogicToPyv.translate(fml).toString());
    }

    @Test
    public void newSymbolsAreLeftAloneInOneState() {
        Formula fml = Formula.app(owner.toNew(), Formula.cnst(c));
        assertEquals("new_owner(c)", LogicToPyv.translate(fml).toString());
    }

    @Test
    public void twoStateMarksPostState() {
        Formula fml = Formula.iff(Formula.app(owner.toNew(), Formula.cnst(c.toNew())), Formula.app(owner, Formula.cnst(c)));
        assertEquals("new(owner(new(c))) <-> owner(c)", LogicToPyv.translate(fml, true).toString());
    }

    @Test
    public void globalsUnderNewOverApproximate() {
        Formula fml = Formula.and(Formula.app(owner.toNew(), Formula.cnst(c)), Formula.app(edge, Formula.cnst(c), Formula.cnst(c)));
        PyvExpr e = LogicToPyv.translate(fml, true);
        Set<String> globals = new HashSet<>(Arrays.asList("owner", "edge", "c"));
        assertEquals(new LinkedHashSet<>(Arrays.asList("c", "owner")), LogicToPyv.globalsUnderNew(globals, e));
        assertTrue(LogicToPyv.globalsUnderNew(new HashSet<>(Arrays.asList("edge")), e).isEmpty());
    }

    @Test
    public void globalsInFormula() {
        Formula fml = Formula.and(Formula.app(owner.toNew(), Formula.cnst(c)), Formula.app(owner, Formula.cnst(c)));
        assertEquals(new LinkedHashSet<>(Arrays.asList("new_owner", "c", "owner")), LogicToPyv.globalsInFormula(fml));
    }

    @Test
    public void frameClauses() {
        assertEquals("new(c) = c", LogicToPyv.unchangedClause(c).toString());
        assertEquals("forall X0:node, X1:node. new(edge(X0, X1)) <-> edge(X0, X1)",
                LogicToPyv.unchangedClause(edge).toString());
        assertEquals("forall X0:node. exists V:node. new(f(X0)) = V", LogicToPyv.havocClause(f).toString());
        assertEquals("exists V:node. new(c) = V", LogicToPyv.havocClause(c).toString());
    }
}
