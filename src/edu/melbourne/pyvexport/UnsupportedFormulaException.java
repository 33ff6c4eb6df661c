/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

/**
 * A formula constructor (source, solver or target) the translator does not model.
 */
public class UnsupportedFormulaException extends TranslationException {

    public UnsupportedFormulaException(String message, Object term) {
        super(message, term);
    }
}
