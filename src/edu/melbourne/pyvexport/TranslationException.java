/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

/**
 * Fatal failure of a translation run. Carries the term (source formula,
 * solver expression, target expression or name) that caused it. There is no
 * recovery: the run is aborted and no output is written.
 */
public class TranslationException extends RuntimeException {

    private final Object term;

    public TranslationException(String message, Object term) {
        super(message);
        this.term = term;
    }

    public TranslationException(String message, Object term, Throwable cause) {
        super(message, cause);
        this.term = term;
    }

    public Object getTerm() {
        return term;
    }
}
