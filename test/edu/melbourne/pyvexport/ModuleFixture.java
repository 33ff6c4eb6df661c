/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

import edu.melbourne.pyvexport.logic.Action;
import edu.melbourne.pyvexport.logic.ActionUpdate;
import edu.melbourne.pyvexport.logic.Formula;
import edu.melbourne.pyvexport.logic.LabeledFormula;
import edu.melbourne.pyvexport.logic.Sort;
import edu.melbourne.pyvexport.logic.SourceModule;
import edu.melbourne.pyvexport.logic.Symbol;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hand-built isolate. Actions carry their two-state relation directly; the
 * verification condition of an initializer is its transition relation
 * followed by the {@code ~true} conjunct, as the elaborator produces it.
 */
public class ModuleFixture implements SourceModule {

    private final String name;
    private final Map<String, Sort> sorts = new LinkedHashMap<>();
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final List<Formula> axioms = new ArrayList<>();
    private final List<LabeledFormula> props = new ArrayList<>();
    private final List<LabeledFormula> conjs = new ArrayList<>();
    private final List<Action> initializers = new ArrayList<>();
    private final Map<String, Action> actions = new LinkedHashMap<>();
    private final Set<String> publicActions = new LinkedHashSet<>();
    private boolean dropMustNotFail = false;

    public ModuleFixture(String name) {
        this.name = name;
    }

    public static class FixtureAction implements Action {

        private final Set<Symbol> modified;
        private final Formula transition;
        private final Formula precondition;

        public FixtureAction(Set<Symbol> modified, Formula transition, Formula precondition) {
            this.modified = modified;
            this.transition = transition;
            this.precondition = precondition;
        }

        @Override
        public ActionUpdate update() {
            return new ActionUpdate(modified, transition, precondition);
        }

        @Override
        public List<Symbol> getFormalParams() {
            return Collections.emptyList();
        }
    }

    public static Action action(Formula transition, Symbol... modified) {
        return new FixtureAction(new LinkedHashSet<>(Arrays.asList(modified)), transition, Formula.FALSE);
    }

    public ModuleFixture sort(Sort s) {
        sorts.put(s.getName(), s);
        return this;
    }

    public ModuleFixture symbol(Symbol s) {
        symbols.put(s.getName(), s);
        return this;
    }

    public ModuleFixture axiom(Formula f) {
        axioms.add(f);
        return this;
    }

    public ModuleFixture prop(String label, Formula f, boolean assumed) {
        props.add(new LabeledFormula(label, f, assumed));
        return this;
    }

    public ModuleFixture conj(String label, Formula f) {
        conjs.add(new LabeledFormula(label, f));
        return this;
    }

    public ModuleFixture init(Action a) {
        initializers.add(a);
        return this;
    }

    public ModuleFixture action(String actionName, Action a, boolean isPublic) {
        actions.put(actionName, a);
        if (isPublic) {
            publicActions.add(actionName);
        }
        return this;
    }

    public ModuleFixture withoutMustNotFail() {
        dropMustNotFail = true;
        return this;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Map<String, Sort> getSorts() {
        return sorts;
    }

    @Override
    public Map<String, Symbol> getSymbols() {
        return symbols;
    }

    @Override
    public List<Formula> getAxioms() {
        return axioms;
    }

    @Override
    public List<LabeledFormula> getLabeledProps() {
        return props;
    }

    @Override
    public List<LabeledFormula> getLabeledConjs() {
        return conjs;
    }

    @Override
    public List<Action> getInitializers() {
        return initializers;
    }

    @Override
    public Map<String, Action> getActions() {
        return actions;
    }

    @Override
    public Set<String> getPublicActions() {
        return publicActions;
    }

    @Override
    public Action sequence(List<Action> seq) {
        Set<Symbol> modified = new LinkedHashSet<>();
        List<Formula> trs = new ArrayList<>();
        List<Formula> pres = new ArrayList<>();
        for (Action a : seq) {
            ActionUpdate u = a.update();
            modified.addAll(u.getModified());
            trs.add(u.getTransition());
            pres.add(u.getPrecondition());
        }
        return new FixtureAction(modified, Formula.and(trs), Formula.or(pres));
    }

    @Override
    public Formula makeVc(Action action) {
        List<Formula> terms = new ArrayList<>();
        terms.add(action.update().getTransition());
        if (!dropMustNotFail) {
            terms.add(Formula.not(Formula.TRUE));
        }
        return new Formula.And(terms);
    }
}
