/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

/**
 * Compiling a formula to Z3 and reading it back did not give the same formula.
 */
public class RoundTripException extends TranslationException {

    public RoundTripException(String message, Object term) {
        super(message, term);
    }
}
