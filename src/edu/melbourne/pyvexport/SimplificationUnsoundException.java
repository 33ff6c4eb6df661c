/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

/**
 * Z3 disproved the equivalence of a formula and its simplification.
 */
public class SimplificationUnsoundException extends TranslationException {

    public SimplificationUnsoundException(String message, Object term) {
        super(message, term);
    }
}
