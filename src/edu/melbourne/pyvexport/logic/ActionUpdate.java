/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.logic;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Two-state semantics of an action as computed by the elaborator: the symbols
 * it modifies, the transition relation over pre-state symbols and their
 * {@code new_} copies, and the precondition under which the action fails.
 */
public class ActionUpdate {

    private final Set<Symbol> modified;
    private final Formula transition;
    private final Formula precondition;

    public ActionUpdate(Set<Symbol> modified, Formula transition, Formula precondition) {
        this.modified = Collections.unmodifiableSet(new LinkedHashSet<>(modified));
        this.transition = transition;
        this.precondition = precondition;
    }

    public Set<Symbol> getModified() {
        return modified;
    }

    public Formula getTransition() {
        return transition;
    }

    /**
     * Holds exactly when the action fails.
     */
    public Formula getPrecondition() {
        return precondition;
    }
}
