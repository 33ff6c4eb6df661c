/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import edu.melbourne.pyvexport.logic.Formula;
import edu.melbourne.pyvexport.logic.Sort;
import edu.melbourne.pyvexport.logic.Symbol;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The existential witnesses of a formula, split by sort. First-order ones
 * can be bound as action parameters or existential variables; second-order
 * ones (relations and functions) have to be declared globally and havocked.
 */
public class Witnesses {

    private final List<Symbol> firstOrder;
    private final Set<Symbol> secondOrder;

    private Witnesses(List<Symbol> firstOrder, Set<Symbol> secondOrder) {
        this.firstOrder = Collections.unmodifiableList(firstOrder);
        this.secondOrder = Collections.unmodifiableSet(secondOrder);
    }

    public static Witnesses of(Formula f) {
        Set<Symbol> first = new TreeSet<>();
        Set<Symbol> second = new TreeSet<>();
        for (Symbol s : f.symbols()) {
            if (!s.isSkolem()) {
                continue;
            }
            Sort sort = s.getSort();
            if (sort instanceof Sort.FunctionSort) {
                second.add(s);
            } else if (sort.isFirstOrder()) {
                first.add(s);
            } else {
                throw new UnsupportedSortException("existential " + s + " has unsupported sort", s);
            }
        }
        return new Witnesses(new ArrayList<>(first), second);
    }

    /**
     * Sorted by name.
     */
    public List<Symbol> getFirstOrder() {
        return firstOrder;
    }

    public Set<Symbol> getSecondOrder() {
        return secondOrder;
    }
}
