/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.logic;

/**
 * A property or conjecture of the isolate. The label may be null.
 */
public class LabeledFormula {

    private final String label;
    private final Formula formula;
    private final boolean assumed;

    public LabeledFormula(String label, Formula formula, boolean assumed) {
        this.label = label;
        this.formula = formula;
        this.assumed = assumed;
    }

    public LabeledFormula(String label, Formula formula) {
        this(label, formula, false);
    }

    public String getLabel() {
        return label;
    }

    public Formula getFormula() {
        return formula;
    }

    /**
     * True for properties taken as given in this isolate (proved elsewhere).
     */
    public boolean isAssumed() {
        return assumed;
    }

    @Override
    public String toString() {
        return (label == null ? "" : "[" + label + "] ") + formula;
    }
}
