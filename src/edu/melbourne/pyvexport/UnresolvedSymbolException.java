/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

/**
 * A Z3 declaration with no symbol of that name in the symbol table.
 */
public class UnresolvedSymbolException extends TranslationException {

    public UnresolvedSymbolException(String message, Object term) {
        super(message, term);
    }
}
