/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.logic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import org.junit.Test;

import static org.junit.Assert.*;

public class FormulaTest {

    private final Sort node = Sort.uninterpreted("node");
    private final Symbol edge = new Symbol("edge", Sort.relation(node, node));
    private final Symbol c = new Symbol("c", node);
    private final Symbol p = new Symbol("p", Sort.BOOL);
    private final Symbol q = new Symbol("q", Sort.BOOL);

    @Test
    public void truthIsEmptyConjunction() {
        assertTrue(Formula.TRUE.isTrue());
        assertTrue(Formula.FALSE.isFalse());
        assertEquals(Formula.TRUE, new Formula.And(Collections.<Formula>emptyList()));
        assertFalse(Formula.TRUE.equals(Formula.FALSE));
        assertEquals("true", Formula.TRUE.toString());
        assertEquals("false", Formula.FALSE.toString());
    }

    @Test
    public void factoriesBuildCanonicalForms() {
        Formula a = Formula.cnst(p);
        assertSame(a, Formula.and(a));
        assertSame(a, Formula.or(Arrays.asList(a)));
        assertTrue(Formula.eq(a, Formula.cnst(q)) instanceof Formula.Iff);
        assertTrue(Formula.eq(Formula.cnst(c), Formula.cnst(c)) instanceof Formula.Eq);
        assertTrue(Formula.app(c, new ArrayList<Formula>()) instanceof Formula.Const);
        assertSame(a, Formula.forall(new ArrayList<Formula.Var>(), a));
    }

    @Test
    public void structuralEquality() {
        Formula.Var x = Formula.var("X", node);
        Formula f1 = Formula.forall(Arrays.asList(x), Formula.app(edge, x, Formula.cnst(c)));
        Formula f2 = Formula.forall(Arrays.asList(Formula.var("X", node)),
                Formula.app(edge, Formula.var("X", node), Formula.cnst(c)));
        assertEquals(f1, f2);
        assertEquals(f1.hashCode(), f2.hashCode());
        assertFalse(f1.equals(Formula.exists(Arrays.asList(x), Formula.app(edge, x, Formula.cnst(c)))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void arityIsChecked() {
        new Formula.Apply(edge, Arrays.<Formula>asList(Formula.cnst(c)));
    }

    @Test
    public void symbolsInOrderOfOccurrence() {
        Formula.Var x = Formula.var("X", node);
        Formula f = Formula.and(Formula.cnst(p),
                Formula.forall(Arrays.asList(x), Formula.app(edge, x, Formula.cnst(c))),
                Formula.cnst(p));
        List<Symbol> syms = new ArrayList<>(f.symbols());
        assertEquals(Arrays.asList(p, edge, c), syms);
    }

    @Test
    public void symbolKinds() {
        Symbol f = new Symbol("f", Sort.function(node, node));
        assertEquals(Symbol.Kind.RELATION, edge.getKind());
        assertEquals(Symbol.Kind.FUNCTION, f.getKind());
        assertEquals(Symbol.Kind.INDIVIDUAL, c.getKind());
        assertEquals(2, edge.getArity());
        assertEquals(Sort.BOOL, edge.getRange());
        assertEquals(node, f.getRange());
    }

    @Test
    public void namingConventions() {
        Symbol newEdge = edge.toNew();
        assertEquals("new_edge", newEdge.getName());
        assertTrue(newEdge.isNew());
        assertEquals(edge, newEdge.newOf());
        assertTrue(new Symbol("__x", node).isSkolem());
        assertTrue(new Symbol("fml:x", node).isSkolem());
        assertFalse(c.isSkolem());
        assertTrue(Naming.isTemporary("__m_r"));
        assertFalse(Naming.isNew("new_"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void enumeratedValuesAreDistinct() {
        Sort.enumerated("color", "red", "red");
    }

    @Test
    public void printing() {
        Formula.Var x = Formula.var("X", node);
        Formula f = Formula.forall(Arrays.asList(x),
                Formula.implies(Formula.app(edge, x, Formula.cnst(c)), Formula.not(Formula.eq(x, Formula.cnst(c)))));
        assertEquals("(forall X:node. (edge(X,c) -> ~(X = c)))", f.toString());
    }

    @Test
    public void canonicalizerRebuildsThroughFactories() {
        Formula a = Formula.cnst(p);
        Formula.Var x = Formula.var("X", node);
        Formula edgeXc = Formula.app(edge, x, Formula.cnst(c));
        // forall X. (edge(X, c) & (p = q)) with a one-element conjunction and a Boolean equation
        Formula raw = new Formula.ForAll(Arrays.asList(x), new Formula.And(Arrays.<Formula>asList(
                new Formula.Or(Arrays.<Formula>asList(edgeXc)), new Formula.Eq(a, Formula.cnst(q)))));
        Formula expected = Formula.forall(Arrays.asList(x), Formula.and(edgeXc, Formula.iff(a, Formula.cnst(q))));
        assertEquals(expected, Canonicalizer.canonical(raw));
        assertEquals(a, Canonicalizer.canonical(new Formula.Exists(new ArrayList<Formula.Var>(), new Formula.And(Arrays.asList(a)))));
        assertEquals(expected, Canonicalizer.canonical(expected));
    }

    @Test
    public void symbolsOfTheSameNameOrderBySort() {
        Symbol r1 = new Symbol("__r", Sort.relation(node));
        Symbol r2 = new Symbol("__r", Sort.relation(node, node));
        assertTrue(r1.compareTo(r2) != 0);
        assertEquals(Integer.signum(r1.compareTo(r2)), -Integer.signum(r2.compareTo(r1)));
        assertEquals(0, r1.compareTo(new Symbol("__r", Sort.relation(node))));
        assertEquals(2, new TreeSet<>(Arrays.asList(r1, r2)).size());
    }
}
