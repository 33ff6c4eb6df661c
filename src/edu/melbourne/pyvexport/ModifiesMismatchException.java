/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

/**
 * The modified symbols found in the simplified transition differ from the ones the elaborator reported.
 */
public class ModifiesMismatchException extends TranslationException {

    public ModifiesMismatchException(String message, Object term) {
        super(message, term);
    }
}
