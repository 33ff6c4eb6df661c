/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport;

/**
 * A name that cannot be turned into a mypyvy identifier.
 */
public class InvalidNameException extends TranslationException {

    public InvalidNameException(String message, Object term) {
        super(message, term);
    }
}
