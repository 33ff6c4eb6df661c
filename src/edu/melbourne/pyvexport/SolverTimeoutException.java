/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

/**
 * A tactic or satisfiability check exhausted its time budget.
 */
public class SolverTimeoutException extends TranslationException {

    public SolverTimeoutException(String message, Object term) {
        super(message, term);
    }

    public SolverTimeoutException(String message, Object term, Throwable cause) {
        super(message, term, cause);
    }
}
