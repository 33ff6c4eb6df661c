/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.logic;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The elaborated isolate handed to the exporter. Maps iterate in declaration
 * order.
 */
public interface SourceModule {

    String getName();

    Map<String, Sort> getSorts();

    /**
     * Signature symbols, keyed by their own name.
     */
    Map<String, Symbol> getSymbols();

    List<Formula> getAxioms();

    List<LabeledFormula> getLabeledProps();

    List<LabeledFormula> getLabeledConjs();

    List<Action> getInitializers();

    Map<String, Action> getActions();

    Set<String> getPublicActions();

    /**
     * Sequential composition: later actions observe the state left by earlier
     * ones.
     */
    Action sequence(List<Action> actions);

    /**
     * One-state verification condition of an action. By construction it is a
     * conjunction whose last conjunct is the must-not-fail term
     * {@code ~true}.
     */
    Formula makeVc(Action action);
}
