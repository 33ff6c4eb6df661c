/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

/**
 * The input uses a sort shape mypyvy cannot express.
 */
public class UnsupportedSortException extends TranslationException {

    public UnsupportedSortException(String message, Object term) {
        super(message, term);
    }
}
