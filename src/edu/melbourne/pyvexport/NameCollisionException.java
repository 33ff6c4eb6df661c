/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

/**
 * Two distinct source names translate to the same mypyvy name.
 */
public class NameCollisionException extends TranslationException {

    public NameCollisionException(String message, Object term) {
        super(message, term);
    }
}
